package com.sapa.speakers.dto;

import com.sapa.speakers.tools.ToolDefinition;
import com.sapa.speakers.tools.ToolParameter;

import java.util.List;

public class ToolDtos {

    public static class ToolInfo {
        private String name;
        private String description;
        private List<ToolParameter> parameters;

        public static ToolInfo of(ToolDefinition tool) {
            ToolInfo info = new ToolInfo();
            info.name = tool.name();
            info.description = tool.description();
            info.parameters = tool.parameters();
            return info;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<ToolParameter> getParameters() { return parameters; }
        public void setParameters(List<ToolParameter> parameters) { this.parameters = parameters; }
    }

    public static class ToolResult {
        private String tool;
        private String output;

        public ToolResult() {
        }

        public ToolResult(String tool, String output) {
            this.tool = tool;
            this.output = output;
        }

        public String getTool() { return tool; }
        public void setTool(String tool) { this.tool = tool; }
        public String getOutput() { return output; }
        public void setOutput(String output) { this.output = output; }
    }
}
