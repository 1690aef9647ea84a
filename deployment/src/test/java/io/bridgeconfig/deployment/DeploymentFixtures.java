package io.bridgeconfig.deployment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes deployment directories for the tests. */
final class DeploymentFixtures {

    static final String REQUEST_MANAGER_ADDRESS = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed";
    static final String FILL_MANAGER_ADDRESS = "0xfB6916095ca1df60bB79Ce92cE3Ea74c37c5d359";
    static final String RESOLVER_ADDRESS = "0xdbF03B407c01E7cD3CBea99509d93f8DDDC8C6FB";

    static final String MANIFEST = """
            {
              "chains": {
                "10": {
                  "RequestManager": {"address": "%s", "deployment_block": 1000},
                  "Resolver": {"address": "%s", "deployment_block": 1001}
                },
                "42161": {
                  "FillManager": {"address": "%s", "deployment_block": 2000},
                  "Resolver": {"address": "%s", "deployment_block": 2001}
                }
              }
            }
            """
            .formatted(REQUEST_MANAGER_ADDRESS, RESOLVER_ADDRESS, FILL_MANAGER_ADDRESS, RESOLVER_ADDRESS);

    private DeploymentFixtures() {}

    /** Writes {@link #MANIFEST} and an ABI file for every contract it names. */
    static Path writeDeployment(Path dir) throws IOException {
        write(dir, DeploymentInfoLoader.MANIFEST_FILE, MANIFEST);
        writeAbi(dir, "RequestManager", "request");
        writeAbi(dir, "FillManager", "fill");
        writeAbi(dir, "Resolver", "resolve");
        return dir;
    }

    static void writeAbi(Path dir, String contract, String function) throws IOException {
        write(dir, contract + ".json", """
                {"abi": [{"type": "function", "name": "%s", "inputs": [], "outputs": []}]}
                """.formatted(function));
    }

    static Path write(Path dir, String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
