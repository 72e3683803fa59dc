package com.ai.echomi.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Partial fact update pulled out of one utterance. Any field may be null.
 */
@Getter
@Setter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedFacts {

    private String name;

    private String purpose;

    private String phone;

    private String company;

    public static ExtractedFacts empty() {
        return new ExtractedFacts();
    }

    public boolean isEmpty() {
        return name == null && purpose == null && phone == null && company == null;
    }
}
