package com.example.rpgcampaign;

import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.config.ServerConfig;
import com.example.rpgcampaign.net.RpgConsole;
import com.example.rpgcampaign.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RpgConsole Tests")
class RpgConsoleTest {

    private RpgConsole console;

    @BeforeEach
    void setUp() {
        console = new RpgConsole(new RpgApplication(ServerConfig.inMemory(1L)));
    }

    @Test
    @DisplayName("run processes lines until quit")
    void runUntilQuit() throws Exception {
        String script = String.join("\n",
            "begin_campaign name=\"Shadows of Umbar\" player_name=Ayla",
            "",
            "list_campaigns",
            "quit",
            "list_campaigns");
        StringWriter out = new StringWriter();

        console.run(new StringReader(script), new PrintWriter(out));

        String text = out.toString();
        assertTrue(text.startsWith("RPG campaign server ready."));
        assertTrue(text.contains("Campaign 'Shadows of Umbar' created."));
        assertTrue(text.contains("Campaigns:"));
        assertTrue(text.trim().endsWith("Goodbye."));
    }

    @Test
    @DisplayName("Parse errors come back as error results")
    void parseErrors() {
        ToolResult result = console.execute("get_npc name=\"unterminated");
        assertTrue(result.isError());
        assertEquals(CombatException.Kind.INVALID_ARGUMENT, result.getErrorKind());
    }

    @Test
    @DisplayName("Blank lines produce an empty success")
    void blankLine() {
        ToolResult result = console.execute("   ");
        assertFalse(result.isError());
        assertEquals("", result.getText());
    }
}
