package se.escrow_be.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Human-readable room identifiers: random words from the bundled word list joined by spaces.
 */
@Component
@Slf4j
public class RoomPhraseGenerator {

    private static final String WORDLIST = "wordlist.txt";

    private final SecureRandom random = new SecureRandom();
    private final List<String> words;
    private final int wordsPerPhrase;

    public RoomPhraseGenerator(@Value("${escrow.rooms.phrase-words:4}") int wordsPerPhrase) {
        if (wordsPerPhrase < 2) {
            throw new IllegalArgumentException("A room phrase needs at least two words");
        }
        this.wordsPerPhrase = wordsPerPhrase;
        this.words = loadWords();
        log.info("Loaded {} phrase words, {} per phrase", words.size(), wordsPerPhrase);
    }

    public String nextPhrase() {
        return IntStream.range(0, wordsPerPhrase)
                .mapToObj(i -> words.get(random.nextInt(words.size())))
                .collect(Collectors.joining(" "));
    }

    private static List<String> loadWords() {
        ClassPathResource resource = new ClassPathResource(WORDLIST);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            List<String> loaded = reader.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .map(line -> line.toLowerCase(Locale.ROOT))
                    .distinct()
                    .collect(Collectors.toList());
            if (loaded.size() < 16) {
                throw new IllegalStateException(WORDLIST + " holds too few words: " + loaded.size());
            }
            return List.copyOf(loaded);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + WORDLIST, e);
        }
    }
}
