package io.mersel.services.media.cli.infrastructure;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Kullanıcıya dönük konsol çıktısı ve [y/N] onayı.
 * <p>
 * Log'lardan ayrıdır; komut çıktısı her zaman buradan yazılır.
 */
@Component
public class ConsoleIO {

    private final PrintStream out;
    private final BufferedReader in;

    public ConsoleIO() {
        this(System.out, new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    /**
     * Constructor with injectable streams for testing.
     */
    public ConsoleIO(PrintStream out, Reader in) {
        this.out = out;
        this.in = new BufferedReader(in);
    }

    public void println(String line) {
        out.println(line);
    }

    public void println() {
        out.println();
    }

    /**
     * Soruyu yazar ve yanıt {@code y}/{@code yes} ise {@code true} döner. Girdi yoksa hayır sayılır.
     */
    public boolean confirm(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                out.println();
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            throw new UncheckedIOException("Konsol girdisi okunamadı", e);
        }
    }
}
