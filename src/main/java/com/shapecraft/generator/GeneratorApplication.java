package com.shapecraft.generator;

import com.shapecraft.generator.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Shapecraft projection generator.
 * Reads projection shape files and a type schema and writes DTO types plus
 * forward and reverse transform classes.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
