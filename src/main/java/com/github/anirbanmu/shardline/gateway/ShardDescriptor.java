package com.github.anirbanmu.shardline.gateway;

public record ShardDescriptor(int index, int count) {

    public ShardDescriptor {
        if (count < 1) {
            throw new IllegalArgumentException("shard count must be >= 1, got " + count);
        }
        if (index < 0 || index >= count) {
            throw new IllegalArgumentException("shard index " + index + " out of range for count " + count);
        }
    }

    // discord's routing: shard_id = (guild_id >> 22) % num_shards
    public static int indexForGuild(long guildId, int count) {
        return (int) Long.remainderUnsigned(guildId >>> 22, count);
    }

    public static int indexForGuild(String guildId, int count) {
        try {
            return indexForGuild(Long.parseUnsignedLong(guildId), count);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("guild id is not a snowflake: " + guildId, e);
        }
    }

    public String name() {
        return "shard-" + index;
    }
}
