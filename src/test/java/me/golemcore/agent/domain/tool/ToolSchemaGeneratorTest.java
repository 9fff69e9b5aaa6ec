package me.golemcore.agent.domain.tool;

import me.golemcore.agent.domain.model.ArgumentSpec;
import me.golemcore.agent.domain.model.ArgumentType;
import me.golemcore.agent.domain.model.ToolCapability;
import me.golemcore.agent.domain.model.ToolCategory;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExample;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ToolSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolSchemaGeneratorTest {

    private static ToolDefinition searchTool() {
        return ToolBuilder.create()
                .id("search")
                .description("Search files.")
                .category(ToolCategory.SEARCH)
                .capabilities(ToolCapability.FILE_READ)
                .tags("grep")
                .stringArg("query", "What to find", arg -> arg.required(true))
                .stringArg("search_type", "Kind", arg -> arg.enumValues(List.of("text", "files")).defaultValue("text"))
                .argument(ArgumentSpec.builder().name("hint").type(ArgumentType.ANY).build())
                .example(new ToolExample("Find TODOs", Map.of("query", "TODO"), null))
                .execute((args, ctx) -> ToolResult.success(""))
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildJsonSchemaParameters() {
        ToolSchema schema = ToolSchemaGenerator.toSchema(searchTool());

        assertEquals("search", schema.getName());
        Map<String, Object> parameters = schema.getInputSchema();
        assertEquals("object", parameters.get("type"));
        assertEquals(List.of("query"), parameters.get("required"));

        Map<String, Object> properties = (Map<String, Object>) parameters.get("properties");
        Map<String, Object> searchType = (Map<String, Object>) properties.get("search_type");
        assertEquals("string", searchType.get("type"));
        assertEquals(List.of("text", "files"), searchType.get("enum"));
        assertEquals("text", searchType.get("default"));
        assertEquals("string", ((Map<String, Object>) properties.get("hint")).get("type"));
    }

    @Test
    void shouldDescribeCapabilitiesTagsAndExamples() {
        String description = ToolSchemaGenerator.toSchema(searchTool()).getDescription();

        assertEquals("Search files. Capabilities: read files. Tags: grep. Examples: Find TODOs {query=TODO}",
                description);
    }

    @Test
    void shouldGroupPromptSectionByCategory() {
        ToolDefinition pwd = ToolBuilder.create()
                .id("pwd")
                .description("Print working directory")
                .category(ToolCategory.FILE_SYSTEM)
                .execute((args, ctx) -> ToolResult.success(""))
                .build();

        String section = ToolSchemaGenerator.promptSection(List.of(searchTool(), pwd));

        assertTrue(section.startsWith("# Available Tools\n"));
        assertTrue(section.indexOf("## File System") < section.indexOf("## Search"));
        assertTrue(section.contains("- **pwd**: Print working directory\n"));
        assertEquals("", ToolSchemaGenerator.promptSection(List.of()));
    }
}
