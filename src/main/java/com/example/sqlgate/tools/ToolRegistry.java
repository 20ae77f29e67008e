package com.example.sqlgate.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public void register(Tool tool) {
        if (tools.putIfAbsent(tool.getName(), tool) != null) {
            throw new IllegalArgumentException("Tool already registered: " + tool.getName());
        }
    }

    public Tool get(String name) {
        return tools.get(name);
    }

    public List<Tool> list() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }
}
