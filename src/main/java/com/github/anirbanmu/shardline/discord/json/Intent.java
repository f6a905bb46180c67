package com.github.anirbanmu.shardline.discord.json;

import java.util.Collection;
import java.util.Locale;

// gateway intents; identify carries the OR of their bits
public enum Intent {
    GUILDS(0),
    GUILD_MEMBERS(1),
    GUILD_MODERATION(2),
    GUILD_EXPRESSIONS(3),
    GUILD_INTEGRATIONS(4),
    GUILD_WEBHOOKS(5),
    GUILD_INVITES(6),
    GUILD_VOICE_STATES(7),
    GUILD_PRESENCES(8),
    GUILD_MESSAGES(9),
    GUILD_MESSAGE_REACTIONS(10),
    GUILD_MESSAGE_TYPING(11),
    DIRECT_MESSAGES(12),
    DIRECT_MESSAGE_REACTIONS(13),
    DIRECT_MESSAGE_TYPING(14),
    MESSAGE_CONTENT(15),
    GUILD_SCHEDULED_EVENTS(16),
    AUTO_MODERATION_CONFIGURATION(20),
    AUTO_MODERATION_EXECUTION(21),
    GUILD_MESSAGE_POLLS(24),
    DIRECT_MESSAGE_POLLS(25);

    private final int bit;

    Intent(int shift) {
        this.bit = 1 << shift;
    }

    public int bit() {
        return bit;
    }

    public static int mask(Collection<Intent> intents) {
        int mask = 0;
        for (Intent intent : intents) {
            mask |= intent.bit;
        }
        return mask;
    }

    public static Intent fromString(String value) {
        try {
            return Intent.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown intent: '" + value + "'", e);
        }
    }
}
