package com.ai.echomi.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One forwarded SMS as read from the courier's phone.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class SmsMessageDto {

    private String sender;

    private String message;

    private String timestamp;
}
