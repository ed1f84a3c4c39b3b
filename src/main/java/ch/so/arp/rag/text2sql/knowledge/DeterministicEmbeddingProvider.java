package ch.so.arp.rag.text2sql.knowledge;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic embedding provider based on feature hashing. Every token of
 * the text is hashed into one signed dimension, so texts that share words get
 * similar vectors. It allows the application to run without external API calls
 * while retrieval still behaves lexically sensible.
 *
 * <p>Tokens are ASCII identifiers (whole and split at underscores) and CJK
 * unigrams and bigrams.
 */
public class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private static final Pattern WORD = Pattern.compile("[a-z0-9_]+");
    private static final Pattern CJK_RUN = Pattern.compile("\\p{IsHan}+");

    private final int dimensions;

    public DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        for (String token : tokens(text == null ? "" : text)) {
            byte[] hash = sha256(token);
            int index = Math.floorMod(bytesToInt(hash), dimensions);
            vector[index] += (hash[4] & 1) == 0 ? 1.0f : -1.0f;
        }
        VectorMath.normalize(vector);
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "deterministic-" + dimensions;
    }

    static List<String> tokens(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        Matcher words = WORD.matcher(lower);
        while (words.find()) {
            String word = words.group();
            tokens.add(word);
            if (word.indexOf('_') >= 0) {
                for (String part : word.split("_")) {
                    if (!part.isEmpty()) {
                        tokens.add(part);
                    }
                }
            }
        }
        Matcher han = CJK_RUN.matcher(lower);
        while (han.find()) {
            String run = han.group();
            for (int i = 0; i < run.length(); i++) {
                tokens.add(run.substring(i, i + 1));
                if (i + 1 < run.length()) {
                    tokens.add(run.substring(i, i + 2));
                }
            }
        }
        return tokens;
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private int bytesToInt(byte[] bytes) {
        int result = 0;
        for (int i = 0; i < 4; i++) {
            result = (result << 8) | (bytes[i] & 0xFF);
        }
        return result;
    }
}
