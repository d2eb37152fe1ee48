package com.Lezat.Scheduling.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptSentence {

    @Column(length = 255)
    private String speaker;

    private Double startTime;

    private Double endTime;

    @Column(length = 8000)
    private String text;
}
