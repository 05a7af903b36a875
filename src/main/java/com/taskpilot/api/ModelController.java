package com.taskpilot.api;

import com.taskpilot.config.AgentProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/models")
public class ModelController {

    private final AgentProperties properties;

    public ModelController(AgentProperties properties) {
        this.properties = properties;
    }

    @GetMapping
    public ModelListResponse getModels() {
        return new ModelListResponse(properties.getDefaultModel(), List.copyOf(properties.getModels()));
    }

    public record ModelListResponse(String defaultModel, List<AgentProperties.ModelInfo> models) {}
}
