package com.driftmonitor.notification;

public record ChannelResult(String channel, boolean delivered, String ref, String error, int attempts) {

    public static ChannelResult delivered(String channel, String ref, int attempts) {
        return new ChannelResult(channel, true, ref, null, attempts);
    }

    public static ChannelResult failed(String channel, String error, int attempts) {
        return new ChannelResult(channel, false, null, error, attempts);
    }
}
