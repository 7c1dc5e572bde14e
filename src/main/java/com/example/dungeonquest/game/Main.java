package com.example.dungeonquest.game;

import com.example.dungeonquest.persistence.ContentException;
import com.example.dungeonquest.persistence.ContentLoader;
import com.example.dungeonquest.persistence.GameContent;
import com.example.dungeonquest.util.GameConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        GameConfig config = GameConfig.fromEnvironment();
        logger.info("Starting Dungeon Quest (content={}, seed={})",
            config.getContentDirectory(), config.getSeed() != null ? config.getSeed() : "random");

        GameContent content;
        try {
            content = new ContentLoader(config.getContentDirectory()).load();
        } catch (ContentException e) {
            logger.error("Could not load game content", e);
            System.exit(1);
            return;
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        try {
            new ConsoleGame(content, config.createRandomSource(), in, out).run();
        } catch (IOException e) {
            logger.error("Console I/O failed", e);
            System.exit(1);
        }
    }
}
