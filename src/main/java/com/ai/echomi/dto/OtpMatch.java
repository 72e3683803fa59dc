package com.ai.echomi.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The candidate picked from an SMS batch. {@code fallbackUsed} marks a pick made
 * without any company evidence.
 */
@Getter
@ToString
@AllArgsConstructor
public class OtpMatch {

    private final ParsedMessage message;

    private final double score;

    private final boolean fallbackUsed;
}
