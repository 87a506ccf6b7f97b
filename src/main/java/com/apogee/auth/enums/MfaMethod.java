package com.apogee.auth.enums;

/**
 * Second-factor delivery channels.
 */
public enum MfaMethod {
    SMS("sms", "SMS Code"),
    EMAIL("email", "Email Code");

    private final String channel;
    private final String description;

    MfaMethod(String channel, String description) {
        this.channel = channel;
        this.description = description;
    }

    /**
     * Channel name understood by the verification provider.
     */
    public String getChannel() {
        return channel;
    }

    public String getDescription() {
        return description;
    }
}
