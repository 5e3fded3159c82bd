package com.neoforge.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolArgumentParserTest {

    ToolArgumentParser parser = new ToolArgumentParser(new ObjectMapper());

    @Test
    void parse_object_returnsItsFields() {
        assertThat(parser.parse("{\"path\":\"src/main.py\",\"content\":\"print(1)\"}"))
                .contains(Map.of("path", "src/main.py", "content", "print(1)"));
    }

    @Test
    void parse_blankOrNull_meansNoArguments() {
        assertThat(parser.parse(null)).contains(Map.of());
        assertThat(parser.parse("  ")).contains(Map.of());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"path\": ", "<function=write_file>{}</function>", "[\"PRD.md\"]", "null"})
    void parse_anythingButAnObject_isEmpty(String json) {
        assertThat(parser.parse(json)).isEmpty();
    }
}
