package cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    @Test
    void writesCandidatesToOutputFile() throws IOException {
        Path output = tempDir.resolve("result.txt");

        CommandLineInterface.execute(new String[] {"1205", "3", "--output", output.toString()});

        String text = Files.readString(output);
        assertTrue(text.contains("CANDIDATE INPUTS FOR HASH 1205"));
        assertTrue(text.contains("aaa"));
        assertTrue(text.contains("Candidates found: 1"));
    }

    @Test
    void derivesTerminalStateFromInput() throws IOException {
        Path output = tempDir.resolve("collisions.txt");

        CommandLineInterface.execute(new String[] {
            "-", "2", "--input", "b", "--alphabet", "a=1,b=4", "--scale", "1", "--no-parallel",
            "-o", output.toString()});

        String text = Files.readString(output);
        assertTrue(text.contains("CANDIDATE INPUTS FOR HASH 4"));
        assertTrue(text.contains("Candidates found: 2"));
    }

    @Test
    void defaultTerminalStateIsAnArgumentError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> CommandLineInterface.execute(new String[] {"0", "3"}));
        assertTrue(e.getMessage().contains("terminalState"));
    }

    @Test
    void formatterReportsEmptyResult() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ResultFormatter(new PrintStream(buffer, true, StandardCharsets.UTF_8))
            .printResults(15L, List.of(), List.of(), 1500L);

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("No candidates found."));
        assertTrue(text.contains("Execution time: 1.500 seconds"));
        assertTrue(text.contains("Candidates found: 0"));
    }
}
