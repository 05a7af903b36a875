package com.taskpilot.tools;

import java.util.List;

/**
 * A group of related tools contributed to the {@link ToolRegistry} at startup.
 */
public interface ToolProvider {

    List<ToolDescriptor> tools();
}
