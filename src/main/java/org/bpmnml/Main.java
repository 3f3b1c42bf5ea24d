package org.bpmnml;

import org.bpmnml.config.CompilerConfig;
import org.bpmnml.config.CompilerConfigHelper;
import org.bpmnml.generator.BpmnDocumentWriter;
import org.bpmnml.language.io.ModelReader;
import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.validation.Diagnostic;

import java.io.File;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <p>
 * Usage: {@code bpmnml <model.json> [output.bpmn] [--config config.json]}
 */
public class Main {
    private static final String USAGE = "Usage: bpmnml <model.json> [output.bpmn] [--config config.json]";

    private final PrintStream out;
    private final PrintStream err;

    public Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Runs the compiler.
     *
     * @return the process exit code: 0 on success, 1 on diagnostics errors or bad input, 2 on bad usage
     */
    public int run(String[] args) {
        List<String> positional = new ArrayList<>();
        String configPath = null;
        for (int i = 0; i < args.length; i++) {
            if ("--".equals(args[i])) {
                continue;
            }
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    err.println(USAGE);
                    return 2;
                }
                configPath = args[++i];
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            err.println(USAGE);
            return 2;
        }

        String inputPath = new File(positional.get(0)).getAbsolutePath();
        try {
            CompilerConfig config = CompilerConfigHelper.loadConfigFile(configPath);
            BpmnModel model = ModelReader.readModel(new File(inputPath));
            CompilationResult result = new BpmnmlCompiler(config).compile(model);

            for (Diagnostic diagnostic : result.diagnostics()) {
                err.println(inputPath + ": " + diagnostic);
            }
            if (!result.isSuccess()) {
                return 1;
            }

            String xml = result.xml().get();
            if (positional.size() == 2) {
                Path outputPath = Path.of(positional.get(1)).toAbsolutePath();
                BpmnDocumentWriter.writeXml(xml, outputPath);
                out.println("BPMN written to: " + outputPath);
            } else {
                out.print(xml);
            }
            return 0;
        } catch (Exception e) {
            err.println(e.getMessage());
            return 1;
        }
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err).run(args));
    }
}
