package com.github.anirbanmu.shardline.gateway;

import com.github.anirbanmu.shardline.discord.json.GatewayEvent;
import java.io.IOException;

// a dispatch as seen by subscribers, tagged with the shard that received it
public record DispatchEvent(int shard, GatewayEvent.Dispatch dispatch) {

    public String type() {
        return dispatch.type();
    }

    public Integer sequence() {
        return dispatch.sequence();
    }

    public <T> T decode(Class<T> dataType) throws IOException {
        return dispatch.decode(dataType);
    }
}
