package com.openforge.recall.memory;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class MemoryNotFoundException extends RuntimeException {

    public MemoryNotFoundException(long id) {
        super("Memory entry not found: " + id);
    }
}
