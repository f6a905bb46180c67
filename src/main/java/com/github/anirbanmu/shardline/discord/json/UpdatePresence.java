package com.github.anirbanmu.shardline.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// opcode 3 presence update; also embedded in identify
@CompiledJson
public record UpdatePresence(@JsonAttribute(nullable = true) Long since, List<Activity> activities, String status, boolean afk) {

    public static final String STATUS_ONLINE = "online";
    public static final String STATUS_DND = "dnd";
    public static final String STATUS_IDLE = "idle";
    public static final String STATUS_INVISIBLE = "invisible";
    public static final String STATUS_OFFLINE = "offline";

    public static UpdatePresence online() {
        return new UpdatePresence(null, List.of(), STATUS_ONLINE, false);
    }

    @CompiledJson
    public record Activity(String name, int type) {
        public static final int TYPE_PLAYING = 0;
        public static final int TYPE_STREAMING = 1;
        public static final int TYPE_LISTENING = 2;
        public static final int TYPE_WATCHING = 3;
        public static final int TYPE_CUSTOM = 4;
        public static final int TYPE_COMPETING = 5;
    }
}
