package com.example.rpgcampaign.net;

import com.example.rpgcampaign.RpgApplication;
import com.example.rpgcampaign.combat.CombatException;
import com.example.rpgcampaign.config.ServerConfig;
import com.example.rpgcampaign.tools.ToolRequest;
import com.example.rpgcampaign.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented front end: reads tool invocations from stdin and prints their results.
 */
public class RpgConsole {

    private static final Logger logger = LoggerFactory.getLogger(RpgConsole.class);

    private final RpgApplication app;

    public RpgConsole(RpgApplication app) {
        this.app = app;
    }

    /**
     * Process lines until end of input or "quit".
     */
    public void run(Reader input, PrintWriter out) throws IOException {
        BufferedReader in = new BufferedReader(input);
        out.println("RPG campaign server ready. Type 'help' for tools, 'quit' to exit.");
        out.flush();

        String line;
        while ((line = in.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.equalsIgnoreCase("quit") || trimmed.equalsIgnoreCase("exit")) {
                out.println("Goodbye.");
                break;
            }
            out.println(execute(trimmed).getText());
            out.flush();
        }
        out.flush();
    }

    /**
     * Parse and run one line. Blank lines produce an empty success.
     */
    public ToolResult execute(String line) {
        ToolRequest request;
        try {
            request = CommandParser.parse(line);
        } catch (CombatException e) {
            return ToolResult.error(e);
        }
        if (request == null) {
            return ToolResult.ok("");
        }
        return app.call(request);
    }

    public static void main(String[] args) throws IOException {
        ServerConfig config = ServerConfig.load();
        RpgApplication app = new RpgApplication(config);
        logger.info("Console started");
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        new RpgConsole(app).run(new InputStreamReader(System.in, StandardCharsets.UTF_8), out);
        logger.info("Console stopped");
    }
}
