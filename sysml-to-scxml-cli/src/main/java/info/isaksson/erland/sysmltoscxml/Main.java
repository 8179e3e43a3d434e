package info.isaksson.erland.sysmltoscxml;

import info.isaksson.erland.sysmltoscxml.core.SysmlToScxmlOptions;
import info.isaksson.erland.sysmltoscxml.core.SysmlToScxmlResult;
import info.isaksson.erland.sysmltoscxml.core.SysmlToScxmlService;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionException;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionWarning;
import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;
import info.isaksson.erland.sysmltoscxml.report.ReportGenerator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Set;

/**
 * CLI entrypoint: read a SysML model JSON file, convert one state machine and write SCXML.
 */
public final class Main {

    private static final SysmlToScxmlService SERVICE = new SysmlToScxmlService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.model == null) {
            System.err.println("Error: --model is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path modelPath = Paths.get(parsed.model).toAbsolutePath().normalize();
        if (!Files.exists(modelPath) || Files.isDirectory(modelPath)) {
            System.err.println("Error: --model must point to an existing model JSON file: " + modelPath);
            return 1;
        }

        final SysmlToScxmlResult res;
        try {
            res = SERVICE.convertFile(modelPath, toCoreOptions(parsed));
        } catch (ConversionException ex) {
            System.err.println("Error: conversion failed (" + ex.error() + ", element " + ex.elementId() + ").");
            System.err.println(ex.getMessage());
            return 2;
        } catch (RuntimeException | IOException ex) {
            System.err.println("Error: could not convert model: " + modelPath);
            System.err.println(ex.getMessage());
            return 2;
        }

        final Path scxmlOut = resolveScxmlOutput(parsed.output, res.stateMachineName);
        try {
            Files.createDirectories(scxmlOut.getParent());
            Files.writeString(scxmlOut, res.scxmlString, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Error: could not write SCXML to: " + scxmlOut);
            System.err.println(e.getMessage());
            return 2;
        }

        Path reportOut = null;
        if (parsed.report != null && !parsed.report.isBlank()) {
            reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            try {
                ReportGenerator.writeMarkdown(reportOut, modelPath, scxmlOut, res, parsed.eventKinds, parsed.failOnWarnings);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        for (ConversionWarning w : res.warnings) {
            System.err.println("Warning: " + w);
        }

        System.out.println(
                "sysml-to-scxml\n" +
                "- Model: " + modelPath + "\n" +
                "- SCXML: " + scxmlOut + "\n" +
                (reportOut != null ? "- Report: " + reportOut + "\n" : "") +
                "- State machine: " + res.stateMachineName + "\n" +
                "- Initial state: " + res.initialState + "\n" +
                "- States: " + res.stateCount + "\n" +
                "- Transitions: " + res.transitionCount + "\n" +
                "- Warnings: " + res.warnings.size()
        );

        // Exit code rules
        if (parsed.failOnWarnings && res.hasWarnings()) {
            System.err.println("Conversion produced " + res.warnings.size() + " warning(s) and --fail-on-warnings is set.");
            return 3;
        }
        return 0;
    }

    private static SysmlToScxmlOptions toCoreOptions(CliArgs parsed) {
        SysmlToScxmlOptions o = new SysmlToScxmlOptions();
        o.stateMachineName = parsed.stateMachine;
        o.eventDefinitionKinds = parsed.eventKinds;
        o.failOnWarnings = parsed.failOnWarnings;
        return o;
    }

    static Path resolveScxmlOutput(String outputArg, String stateMachineName) {
        // A path ending with .scxml is the output file; anything else is a directory.
        if (outputArg != null && outputArg.toLowerCase().endsWith(".scxml")) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve(fileNameFor(stateMachineName) + ".scxml");
    }

    /** State machine name as a single path segment: separators and other unsafe characters become '_'. */
    static String fileNameFor(String stateMachineName) {
        if (stateMachineName == null) return "statemachine";
        String s = stateMachineName.trim().replaceAll("[^\\p{L}\\p{N}._-]", "_");
        if (s.isEmpty() || s.matches("\\.+")) return "statemachine";
        return s;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String model;
        String output = "./output";
        String stateMachine;
        String report;
        Set<SysmlElementKind> eventKinds = EnumSet.of(SysmlElementKind.ATTRIBUTE_DEFINITION);
        boolean failOnWarnings = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--model":
                        out.model = requireValue(args, ++i, "--model");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--state-machine":
                        out.stateMachine = requireValue(args, ++i, "--state-machine");
                        break;
                    case "--event-kinds":
                        out.eventKinds = parseKinds(requireValue(args, ++i, "--event-kinds"), "--event-kinds");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--fail-on-warnings":
                        out.failOnWarnings = parseBoolean(requireValue(args, ++i, "--fail-on-warnings"), "--fail-on-warnings");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --model
                        if (out.model == null) {
                            out.model = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static Set<SysmlElementKind> parseKinds(String v, String flag) {
            Set<SysmlElementKind> kinds = EnumSet.noneOf(SysmlElementKind.class);
            for (String part : v.split(",")) {
                if (part.isBlank()) continue;
                kinds.add(SysmlElementKind.parseCli(part));
            }
            if (kinds.isEmpty()) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return kinds;
        }

        static void printHelp() {
            System.out.println(
                    "sysml-to-scxml\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar sysml-to-scxml.jar --model <file.json> [--output <dir|file.scxml>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --model <file.json>        SysML model JSON (required; a bare path is also accepted)\n" +
                    "  --output <path>            Output folder or .scxml file (default: ./output/<machine>.scxml)\n" +
                    "  --state-machine <name>     State definition to convert. Required when the model\n" +
                    "                             declares more than one.\n" +
                    "  --event-kinds <list>       Comma separated element kinds accepted as event definitions:\n" +
                    "                             attribute | item (default: attribute)\n" +
                    "  --report <file.md>         Write a markdown conversion report\n" +
                    "  --fail-on-warnings <bool>  Exit with code 3 when the conversion produced warnings.\n" +
                    "                             Default: false.\n" +
                    "  -h, --help                 Show help\n" +
                    "\n" +
                    "Exit codes:\n" +
                    "  0 success, 1 usage error, 2 conversion or I/O failure, 3 warnings with --fail-on-warnings\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/sysml-to-scxml.jar --model samples/traffic-light.json --output out\n" +
                    "  java -jar target/sysml-to-scxml.jar samples/traffic-light.json\n"
            );
        }
    }
}
