package com.filedrop.client;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import com.filedrop.transfer.StatusListener;
import com.filedrop.transfer.TransferResult;
import com.filedrop.transport.TcpTransportChannel;
import com.filedrop.transport.TransportChannelFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command line entry point: sends one or more files to a FileDrop server.
 * Exit code is 0 when every file was delivered, 1 otherwise.
 */
@Command(name = "filedrop-send", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Send files to a FileDrop server, one connection per file")
public class FileDropClientCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to send")
    List<Path> files;

    @Option(names = "--host", defaultValue = "localhost", description = "Server host (default: ${DEFAULT-VALUE})")
    String host;

    @Option(names = "--port", defaultValue = "8888", description = "Server port (default: ${DEFAULT-VALUE})")
    int port;

    @Option(names = "--chunk-size", defaultValue = "" + FileSender.DEFAULT_CHUNK_SIZE,
            description = "Bytes per data frame (default: ${DEFAULT-VALUE})")
    int chunkSize;

    @Option(names = "--connect-timeout", defaultValue = "" + TcpTransportChannel.DEFAULT_CONNECT_TIMEOUT,
            description = "Connect timeout in milliseconds (default: ${DEFAULT-VALUE})")
    int connectTimeout;

    @Option(names = { "-v", "--verbose" }, description = "Print every status line, including per-chunk progress")
    boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (chunkSize <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--chunk-size must be positive");
        }

        StatusListener listener = verbose ? out::println : message -> {
        };
        FileSender sender = new FileSender(TransportChannelFactory.tcp(host, port, connectTimeout), chunkSize,
                listener);

        List<TransferResult> results = files.size() == 1
                ? List.of(sender.sendFile(files.get(0)))
                : sender.sendMultipleFiles(files);

        int failed = 0;
        for (int i = 0; i < results.size(); i++) {
            TransferResult result = results.get(i);
            if (result.success()) {
                out.println("Sent " + files.get(i) + ": " + result.message());
            } else {
                failed++;
                spec.commandLine().getErr().println("Failed to send " + files.get(i) + ": " + result.describe());
            }
        }
        if (files.size() > 1) {
            out.println((results.size() - failed) + " of " + results.size() + " file(s) sent");
        }
        out.flush();
        return failed == 0 ? 0 : 1;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new FileDropClientCommand()).execute(args));
    }
}
