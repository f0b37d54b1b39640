package com.zzf.cryptoagent.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.cryptoagent.core.tool.ToolProtocol.ToolOutcome;
import com.zzf.cryptoagent.core.tool.ToolProtocol.ToolSpec;

public interface ToolHandler {
    ToolSpec spec();
    ToolOutcome execute(JsonNode args, ToolExecutionContext ctx);
}
