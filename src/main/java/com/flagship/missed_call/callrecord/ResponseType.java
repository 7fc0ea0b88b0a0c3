package com.flagship.missed_call.callrecord;

/**
 * Why the caller got the reply they got.
 */
public enum ResponseType {
    /** Hang-up during business hours, no recording. */
    STANDARD,
    /** Caller left a voicemail during business hours. */
    VOICEMAIL,
    /** Call outside business hours, with or without a recording. */
    AFTER_HOURS
}
