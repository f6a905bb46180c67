package com.github.anirbanmu.shardline.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// READY dispatch data, only the fields the session needs
@CompiledJson
public record Ready(@JsonAttribute(name = "session_id") String sessionId, @JsonAttribute(name = "resume_gateway_url", nullable = true) String resumeGatewayUrl) {
}
