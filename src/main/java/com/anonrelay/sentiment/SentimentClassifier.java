package com.anonrelay.sentiment;

import com.anonrelay.shared.model.Sentiment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical sentiment and urgency scoring. Stateless; the same text always yields the same result.
 * The output is only used to triage and alert, it never rejects a message.
 */
public class SentimentClassifier {

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final double POLARITY_THRESHOLD = 0.2;

    private final Lexicon lexicon;

    public SentimentClassifier(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    public SentimentResult classify(String text) {
        if (text == null || text.isBlank()) return SentimentResult.EMPTY;

        var lowered = text.toLowerCase(Locale.ROOT);
        var tokens = tokenize(lowered);

        boolean urgent = lexicon.urgent().stream()
                .anyMatch(term -> tokens.contains(term) || lowered.contains(term));
        int pos = count(lexicon.positive(), tokens, lowered);
        int neg = count(lexicon.negative(), tokens, lowered);

        int total = pos + neg;
        if (total == 0) {
            return new SentimentResult(Sentiment.NEUTRAL, 0.0, urgent, 0, 0);
        }
        double score = BigDecimal.valueOf((double) (pos - neg) / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
        Sentiment sentiment;
        if (score > POLARITY_THRESHOLD) {
            sentiment = Sentiment.POSITIVE;
        } else if (score < -POLARITY_THRESHOLD) {
            sentiment = Sentiment.NEGATIVE;
        } else {
            sentiment = Sentiment.NEUTRAL;
        }
        return new SentimentResult(sentiment, score, urgent, pos, neg);
    }

    static Set<String> tokenize(String lowered) {
        var tokens = new HashSet<String>();
        var m = WORD.matcher(lowered);
        while (m.find()) tokens.add(m.group());
        return tokens;
    }

    // a term counts once, whether it matched as a token or only as a substring
    private static int count(Set<String> terms, Set<String> tokens, String lowered) {
        int hits = 0;
        for (var term : terms) {
            if (tokens.contains(term) || lowered.contains(term)) hits++;
        }
        return hits;
    }
}
