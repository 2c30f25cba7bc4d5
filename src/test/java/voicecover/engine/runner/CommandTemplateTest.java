package voicecover.engine.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandTemplateTest {

    @Test
    void parseSplitsOnWhitespaceAndHonorsQuotes() {
        CommandTemplate t = CommandTemplate.parse(
                "python  'my script.py' --name \"a \\\"b\\\"\" plain\\ arg");

        assertEquals(List.of("python", "my script.py", "--name", "a \"b\"", "plain arg"), t.tokens());
    }

    @Test
    void parseEmptyOrNull() {
        assertTrue(CommandTemplate.parse("   ").isEmpty());
        assertTrue(CommandTemplate.parse(null).isEmpty());
    }

    @Test
    void parseRejectsUnterminatedQuote() {
        assertThrows(IllegalArgumentException.class, () -> CommandTemplate.parse("ffmpeg -i 'oops"));
    }

    @Test
    @DisplayName("Placeholders are substituted inside arguments, values are never re-split")
    void renderSubstitutes() {
        CommandTemplate t = CommandTemplate.of("{python_exec}", "infer.py", "--model={model_id}", "{input}");

        List<String> cmd = t.render(Map.of(
                "python_exec", "/opt/py/bin/python",
                "model_id", "tenor v2",
                "input", "/jobs/a b/work/vocal.wav"));

        assertEquals(List.of("/opt/py/bin/python", "infer.py", "--model=tenor v2", "/jobs/a b/work/vocal.wav"), cmd);
    }

    @Test
    void renderKeepsDollarSignsAndBackslashesLiteral() {
        List<String> cmd = CommandTemplate.of("echo", "{v}").render(Map.of("v", "$1 \\n"));
        assertEquals(List.of("echo", "$1 \\n"), cmd);
    }

    @Test
    void renderRejectsUnknownPlaceholder() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommandTemplate.of("tool", "{missing}").render(Map.of()));
        assertTrue(e.getMessage().contains("{missing}"));
    }

    @Test
    void renderRejectsEmptyTemplate() {
        assertThrows(IllegalArgumentException.class, () -> CommandTemplate.of().render(Map.of()));
    }

    @Test
    void toolNameIsExecutableBasename() {
        assertEquals("infer.sh", CommandTemplate.of("/opt/tools/infer.sh", "x").toolName());
        assertEquals("ffmpeg", CommandTemplate.parse("ffmpeg -y").toolName());
    }
}
