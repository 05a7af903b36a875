package com.taskpilot.tools.pkg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.tools.ToolDescriptor;
import com.taskpilot.tools.ToolExecutionException;
import com.taskpilot.tools.ToolProvider;
import com.taskpilot.tools.ToolResult;
import com.taskpilot.tools.file.FileService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.taskpilot.tools.ParameterType.STRING;
import static com.taskpilot.tools.ToolArguments.optionalString;
import static com.taskpilot.tools.ToolArguments.string;
import static com.taskpilot.tools.ToolParameter.optional;
import static com.taskpilot.tools.ToolParameter.required;

/**
 * Package manifest tools: npm registry lookups and edits of the workspace {@code package.json}.
 */
@Component
@Slf4j
public class PackageTools implements ToolProvider {

    static final String PACKAGE_JSON = "package.json";
    static final List<String> PROJECT_FOLDERS = List.of("components", "utils", "constants", "hooks", "services", "types");

    private final FileService fileService;
    private final NpmRegistryClient registryClient;
    private final ObjectMapper objectMapper;

    public PackageTools(FileService fileService, NpmRegistryClient registryClient, ObjectMapper objectMapper) {
        this.fileService = fileService;
        this.registryClient = registryClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ToolDescriptor> tools() {
        return List.of(
                ToolDescriptor.of("npm_info", "Get package information from npm registry",
                        List.of(required("package", STRING, "Package name")),
                        this::npmInfo),
                ToolDescriptor.of("update_package_json", "Add a dependency to package.json",
                        List.of(required("package", STRING, "Package name"),
                                optional("version", STRING, "Version (default: latest)"),
                                optional("type", STRING, "\"dependencies\" or \"devDependencies\"", "dependencies")),
                        this::updatePackageJson),
                ToolDescriptor.of("init_project", "Initialize a project folder structure",
                        List.of(required("name", STRING, "Project name")),
                        this::initProject)
        );
    }

    private ToolResult npmInfo(Map<String, Object> params) {
        NpmPackageInfo info = registryClient.fetch(string(params, "package"));
        String output = info.name() + "\nVersion: " + info.version() + "\n" + info.description()
                + "\nLicense: " + info.license();
        return ToolResult.success(output, info);
    }

    private ToolResult updatePackageJson(Map<String, Object> params) {
        String packageName = string(params, "package");
        String version = optionalString(params, "version");
        String depType = "devDependencies".equals(string(params, "type")) ? "devDependencies" : "dependencies";

        ObjectNode manifest = readManifest();
        JsonNode existing = manifest.get(depType);
        ObjectNode dependencies = existing instanceof ObjectNode node ? node : manifest.putObject(depType);
        dependencies.put(packageName, version != null ? version : "latest");

        try {
            fileService.write(PACKAGE_JSON, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(manifest));
        } catch (JsonProcessingException ex) {
            throw new ToolExecutionException("Failed to serialize package.json", ex);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("package", packageName);
        data.put("type", depType);
        return ToolResult.success("Added " + packageName + " to " + depType + " in package.json", data);
    }

    private ObjectNode readManifest() {
        if (!fileService.exists(PACKAGE_JSON)) {
            throw new ToolExecutionException("package.json not found or invalid");
        }
        try {
            JsonNode root = objectMapper.readTree(fileService.read(PACKAGE_JSON).content());
            if (root instanceof ObjectNode object) {
                return object;
            }
        } catch (JsonProcessingException ex) {
            log.warn("package.json could not be parsed: {}", ex.getOriginalMessage());
        }
        throw new ToolExecutionException("package.json not found or invalid");
    }

    private ToolResult initProject(Map<String, Object> params) {
        String name = string(params, "name");
        List<String> created = new ArrayList<>();
        for (String folder : PROJECT_FOLDERS) {
            try {
                fileService.createDirectory(folder);
                created.add(folder);
            } catch (ToolExecutionException ex) {
                log.debug("Skipping folder {} for project {}: {}", folder, name, ex.getMessage());
            }
        }
        String output = "Initialized project structure:\n" + created.stream()
                .map(folder -> folder + "/")
                .collect(Collectors.joining("\n"));
        return ToolResult.success(output, Map.of("folders", created));
    }
}
