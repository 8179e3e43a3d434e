package info.isaksson.erland.sysmltoscxml.report;

import info.isaksson.erland.sysmltoscxml.core.SysmlToScxmlResult;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionWarning;
import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Human-readable markdown report for one conversion.
 *
 * <p>Warnings are listed in the deterministic order produced by the converter.</p>
 */
public final class ReportGenerator {

    private ReportGenerator() {}

    public static void writeMarkdown(Path reportPath,
                                     Path modelPath,
                                     Path scxmlPath,
                                     SysmlToScxmlResult result,
                                     Set<SysmlElementKind> eventKinds,
                                     boolean failOnWarnings) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(reportPath, toMarkdown(modelPath, scxmlPath, result, eventKinds, failOnWarnings), StandardCharsets.UTF_8);
    }

    public static String toMarkdown(Path modelPath,
                                    Path scxmlPath,
                                    SysmlToScxmlResult result,
                                    Set<SysmlElementKind> eventKinds,
                                    boolean failOnWarnings) {
        StringBuilder report = new StringBuilder();
        report.append("# sysml-to-scxml report\n\n");

        report.append("## Summary\n\n");
        report.append("- Model: `").append(modelPath).append("`\n");
        report.append("- SCXML: `").append(scxmlPath).append("`\n");
        report.append("- State machine: `").append(result.stateMachineName).append("`\n");
        report.append("- Initial state: `").append(result.initialState).append("`\n");
        report.append("- States: **").append(result.stateCount).append("**\n");
        report.append("- Transitions: **").append(result.transitionCount).append("**\n");
        report.append("- Event definition kinds: ").append(kinds(eventKinds)).append("\n");
        report.append("- Fail on warnings: **").append(failOnWarnings).append("**\n");
        report.append("- Warnings: **").append(result.warnings.size()).append("**\n\n");

        report.append("## Warnings\n\n");
        if (result.warnings.isEmpty()) {
            report.append("_(none)_\n");
            return report.toString();
        }
        for (ConversionWarning w : result.warnings) {
            report.append("- `").append(w.code).append("` `").append(w.elementId).append("`: ")
                    .append(w.message).append("\n");
        }
        return report.toString();
    }

    private static String kinds(Set<SysmlElementKind> eventKinds) {
        if (eventKinds == null || eventKinds.isEmpty()) return "_(default)_";
        List<String> names = new ArrayList<>();
        for (SysmlElementKind k : eventKinds) {
            names.add(k.name());
        }
        return "`" + String.join("`, `", names) + "`";
    }
}
