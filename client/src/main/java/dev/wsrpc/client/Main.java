package dev.wsrpc.client;

import dev.wsrpc.client.transport.RpcClient;
import dev.wsrpc.client.transport.RpcClientOptions;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class Main {

    private static final String DEFAULT_URL = "ws://localhost:8080/rpc";

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        String url = option(arguments, "--url", DEFAULT_URL);
        String user = option(arguments, "--user", "wsrpc");
        String password = option(arguments, "--password", "change-me");
        if (arguments.isEmpty()) {
            printUsage();
            return;
        }
        String command = arguments.remove(0);

        RpcClientOptions options = RpcClientOptions.builder()
            .credentials(user, password)
            .build();
        try (RpcClient client = RpcClient.connect(URI.create(url), options)) {
            switch (command) {
                case "echo" -> handleEcho(client, arguments);
                case "add" -> handleAdd(client, arguments);
                case "send" -> handleSend(client, arguments);
                case "listen" -> handleListen(client, arguments);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
        }
    }

    private static void handleEcho(RpcClient client, List<String> arguments) throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("echo requires a text argument");
        }
        String reply = client.invoke("Echo", String.class, arguments.get(0)).get(30, TimeUnit.SECONDS);
        System.out.println("ECHO: " + reply);
    }

    private static void handleAdd(RpcClient client, List<String> arguments) throws Exception {
        if (arguments.size() < 2) {
            throw new IllegalArgumentException("add requires two integers");
        }
        int left = Integer.parseInt(arguments.get(0));
        int right = Integer.parseInt(arguments.get(1));
        Integer sum = client.invoke("Add", Integer.class, left, right).get(30, TimeUnit.SECONDS);
        System.out.println("SUM: " + sum);
    }

    private static void handleSend(RpcClient client, List<String> arguments) throws Exception {
        if (arguments.size() < 2) {
            throw new IllegalArgumentException("send requires a group and a message");
        }
        String group = arguments.get(0);
        client.notify("JoinGroup", group);
        client.notify("SendToGroup", group, arguments.get(1));
        client.notify("LeaveGroup", group);
        System.out.println("SENT to " + group);
    }

    private static void handleListen(RpcClient client, List<String> arguments) throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("listen requires a group");
        }
        String group = arguments.get(0);
        client.on("Receive", push -> System.out.println(push.get(0) + ": " + push.get(1)));
        client.notify("JoinGroup", group);
        String id = client.invoke("Whoami", String.class).get(30, TimeUnit.SECONDS);
        System.out.println("Listening on " + group + " as " + id + " (Ctrl+C to stop)");
        int status = client.closeFuture().get();
        System.out.println("Connection closed with status " + status);
    }

    private static String option(List<String> arguments, String name, String fallback) {
        int index = arguments.indexOf(name);
        if (index < 0) {
            return fallback;
        }
        if (index + 1 >= arguments.size()) {
            throw new IllegalArgumentException(name + " requires a value");
        }
        String value = arguments.remove(index + 1);
        arguments.remove(index);
        return value;
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar wsrpc-client.jar [--url <ws-url>] [--user <name>] [--password <secret>] <command> [args]\n" +
            "Commands:\n" +
            "  echo <text>\n" +
            "  add <a> <b>\n" +
            "  send <group> <message>\n" +
            "  listen <group>");
    }
}
