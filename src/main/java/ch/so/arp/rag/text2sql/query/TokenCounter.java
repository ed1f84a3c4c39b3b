package ch.so.arp.rag.text2sql.query;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Counts tokens with the {@code cl100k_base} encoding.
 */
public class TokenCounter {

    private final Encoding encoding;

    public TokenCounter() {
        this(Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE));
    }

    TokenCounter(Encoding encoding) {
        this.encoding = encoding;
    }

    public int count(String text) {
        return text == null || text.isEmpty() ? 0 : encoding.countTokens(text);
    }
}
