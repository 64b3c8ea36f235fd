package io.conductor.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolArgumentParserTest {
    private final ToolArgumentParser parser = new ToolArgumentParser(new ObjectMapper());

    @Test
    void shouldParseJsonObject() {
        Map<String, Object> arguments = parser.parse("{\"city\": \"Oslo\", \"days\": 2}");

        assertThat(arguments).containsEntry("city", "Oslo").containsEntry("days", 2);
    }

    @Test
    void shouldCoerceKeyValueLines() {
        Map<String, Object> arguments = parser.parse("""
            "city": 'Oslo'
            days: 2
            ratio: 0.5
            big: 12345678901
            verbose: FALSE
            note: two words
            """);

        assertThat(arguments)
            .containsEntry("city", "Oslo")
            .containsEntry("days", 2)
            .containsEntry("ratio", 0.5)
            .containsEntry("big", 12345678901d)
            .containsEntry("verbose", false)
            .containsEntry("note", "two words");
    }

    @Test
    void shouldReturnEmptyArgumentsForBlankInput() {
        assertThat(parser.parse("  ")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
