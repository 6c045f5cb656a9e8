package com.qmb.dispatch.tools;

import java.util.List;

/**
 * Name, arguments and one-line description of a model builder tool.
 */
public record ToolDescriptor(String name, List<String> arguments, String description) {

    public String signature() {
        return name + "(" + String.join(", ", arguments) + ")";
    }
}
