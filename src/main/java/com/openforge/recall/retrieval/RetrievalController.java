package com.openforge.recall.retrieval;

import com.openforge.recall.persona.PersonaMode;
import com.openforge.recall.persona.PersonaState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/context/retrieve
 *
 * Called by the conversation service once per turn, before generation.
 * Always 200: a failed retrieval still returns an (empty) context and a trace.
 */
@RestController
@RequestMapping("/api/context")
@RequiredArgsConstructor
public class RetrievalController {

    private final ContextRetrievalService retrievalService;

    @PostMapping("/retrieve")
    public ResponseEntity<RetrievedContext> retrieve(@Valid @RequestBody RetrieveRequest req) {
        PersonaState persona = new PersonaState(
                req.chaosLevel() != null ? req.chaosLevel() : 0,
                req.mode(),
                req.preset());
        return ResponseEntity.ok(
                retrievalService.retrieveContext(req.message(), req.profileId(), req.conversationId(), persona));
    }

    public record RetrieveRequest(
            @Size(max = 8000)         String      message,
            @NotBlank @Size(max = 64) String      profileId,
            String                                conversationId,
            @Min(0) @Max(100)         Integer     chaosLevel,
            PersonaMode                           mode,
            String                                preset
    ) {}
}
