package com.salestracker.platform.model;

public enum ActivityType {
    CALL("📞"),
    MEETING("📅"),
    QUOTE("💰"),
    COLLAB("🤝"),
    PRESENT("🤗"),
    TRAINING("📚"),
    CONTRACT("✍️"),
    OTHER("📍");

    private final String emoji;

    ActivityType(String emoji) {
        this.emoji = emoji;
    }

    public String getEmoji() {
        return emoji;
    }
}
