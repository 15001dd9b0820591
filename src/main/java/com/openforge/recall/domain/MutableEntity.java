package com.openforge.recall.domain;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.LastModifiedDate;

import java.time.LocalDateTime;

/**
 * Rows that upserts merge into.  {@code version} makes two concurrent merges
 * of the same memory fail the second flush instead of silently losing the
 * first one's confidence bump.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class MutableEntity extends BaseEntity {

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    @Version
    @Column(nullable = false)
    private Integer version;
}
