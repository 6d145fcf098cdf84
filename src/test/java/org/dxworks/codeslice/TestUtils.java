package org.dxworks.codeslice;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class TestUtils {
    public static String sample(String relativePath) throws IOException {
        return Files.readString(Paths.get("src/test/resources/samples", relativePath), StandardCharsets.UTF_8);
    }
}
