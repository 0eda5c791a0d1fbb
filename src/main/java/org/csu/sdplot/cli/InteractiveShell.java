package org.csu.sdplot.cli;

import org.csu.sdplot.engine.CommandProcessor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * 交互式控制台：逐行读取命令，交给 {@link CommandProcessor} 执行并打印结果。
 * <p>
 * 用法: {@code InteractiveShell [--precision <digits>]}
 */
public class InteractiveShell {

    private final CommandProcessor processor;
    private final PrintStream out;

    public InteractiveShell(CommandProcessor processor, PrintStream out) {
        this.processor = processor;
        this.out = out;
    }

    public static void main(String[] args) {
        int precision;
        try {
            precision = parsePrecision(args);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.err.println("Usage: InteractiveShell [--precision <digits>]");
            System.exit(1);
            return;
        }

        InteractiveShell shell = new InteractiveShell(new CommandProcessor(precision), System.out);
        try {
            shell.run(System.in);
        } catch (IOException e) {
            System.err.println("Error reading input: " + e.getMessage());
        }
    }

    /**
     * 运行读取-执行-打印循环，直到输入结束或遇到 exit / quit。
     */
    public void run(InputStream input) throws IOException {
        out.println("sdplot expression shell. Type 'help' for commands, 'exit' to quit.");
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        while (true) {
            out.print("sdplot> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String command = line.trim();
            if (command.endsWith(";")) {
                command = command.substring(0, command.length() - 1).trim();
            }
            if (command.isEmpty()) {
                continue;
            }
            if (command.equalsIgnoreCase("exit") || command.equalsIgnoreCase("quit")) {
                break;
            }
            out.println(processor.executeAndGetResult(command));
        }
        out.println("Bye!");
    }

    static int parsePrecision(String[] args) {
        int precision = CommandProcessor.DEFAULT_PRECISION;
        for (int i = 0; i < args.length; i++) {
            if ("--precision".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for --precision.");
                }
                try {
                    precision = Integer.parseInt(args[++i]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid precision '" + args[i] + "'.", e);
                }
                if (precision < 1) {
                    throw new IllegalArgumentException("Precision must be at least 1.");
                }
            } else {
                throw new IllegalArgumentException("Unknown argument '" + args[i] + "'.");
            }
        }
        return precision;
    }
}
