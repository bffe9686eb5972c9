package com.parichay.api.safety;

import com.parichay.core.domain.SafetyFlags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic content-safety scanner.
 *
 * Five independent detectors run over the message text: phone numbers, e-mail addresses,
 * UPI payment ids, links to hosts outside the platform, and configured keywords.
 * The scanner is stateless after construction and safe to share between threads.
 */
@Component
public class ContentSafetyScanner {

    private static final Logger log = LoggerFactory.getLogger(ContentSafetyScanner.class);

    public static final int DEFAULT_PHONE_MIN_DIGITS = 10;
    public static final String DEFAULT_KEYWORDS =
            "whatsapp,wa.me,telegram,earn money,get rich,guaranteed returns,free money,no investment," +
            "bitcoin,crypto,wire transfer,bank account,advance payment,registration fee";
    public static final String DEFAULT_ALLOWED_DOMAINS = "parichay.in,parichay.app";
    public static final String DEFAULT_UPI_HANDLES =
            "upi,ybl,ibl,axl,apl,yapl,paytm,okaxis,oksbi,okhdfcbank,okicici,ptyes,ptaxis,pthdfc,ptsbi," +
            "axisbank,icici,sbi,hdfcbank,kotak,barodampay,idfcbank,rbl,aubank,fbl,ratn,freecharge," +
            "jupiteraxis,waaxis,wahdfcbank";

    /** Digits joined by at most two separator characters, optional leading "+". */
    private static final Pattern PHONE_CANDIDATE = Pattern.compile("\\+?\\(?\\d(?:[\\s.()\\-]{0,2}\\d)+");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");
    private static final Pattern UPI_CANDIDATE =
            Pattern.compile("(?<![A-Za-z0-9._\\-])[A-Za-z0-9._\\-]{2,}@([A-Za-z][A-Za-z0-9]*)\\b(?!\\.[A-Za-z0-9])");
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)[^\\s<>\"']+");

    private final int phoneMinDigits;
    private final Set<String> allowedDomains;
    private final Set<String> upiHandles;
    private final Pattern keywordPattern;

    @Autowired
    public ContentSafetyScanner(
            @Value("${parichay.safety.phone-min-digits:" + DEFAULT_PHONE_MIN_DIGITS + "}") int phoneMinDigits,
            @Value("${parichay.safety.keywords:" + DEFAULT_KEYWORDS + "}") String keywords,
            @Value("${parichay.safety.allowed-domains:" + DEFAULT_ALLOWED_DOMAINS + "}") String allowedDomains,
            @Value("${parichay.safety.upi-handles:" + DEFAULT_UPI_HANDLES + "}") String upiHandles) {
        this(phoneMinDigits, split(keywords), split(allowedDomains), split(upiHandles));
    }

    public ContentSafetyScanner(int phoneMinDigits, Collection<String> keywords,
                                Collection<String> allowedDomains, Collection<String> upiHandles) {
        if (phoneMinDigits < 4) {
            throw new IllegalArgumentException("phone-min-digits must be at least 4");
        }
        this.phoneMinDigits = phoneMinDigits;
        this.allowedDomains = normalize(allowedDomains);
        this.upiHandles = normalize(upiHandles);
        this.keywordPattern = compileKeywords(normalize(keywords));
    }

    public static ContentSafetyScanner withDefaults() {
        return new ContentSafetyScanner(DEFAULT_PHONE_MIN_DIGITS, split(DEFAULT_KEYWORDS),
                split(DEFAULT_ALLOWED_DOMAINS), split(DEFAULT_UPI_HANDLES));
    }

    public SafetyFlags scan(String text) {
        if (text == null || text.isBlank()) {
            return SafetyFlags.NONE;
        }
        SafetyFlags flags = new SafetyFlags(
                containsPhone(text),
                EMAIL.matcher(text).find(),
                containsUpi(text),
                containsExternalLink(text),
                keywordPattern != null && keywordPattern.matcher(text).find());
        if (flags.any()) {
            log.debug("Safety detectors matched: {}", flags.matchedDetectors());
        }
        return flags;
    }

    boolean containsPhone(String text) {
        Matcher matcher = PHONE_CANDIDATE.matcher(text);
        while (matcher.find()) {
            if (countDigits(matcher.group()) >= phoneMinDigits) {
                return true;
            }
        }
        return false;
    }

    boolean containsUpi(String text) {
        Matcher matcher = UPI_CANDIDATE.matcher(text);
        while (matcher.find()) {
            if (upiHandles.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    boolean containsExternalLink(String text) {
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            String host = hostOf(matcher.group());
            if (!host.isEmpty() && !isAllowedHost(host)) {
                return true;
            }
        }
        return false;
    }

    private boolean isAllowedHost(String host) {
        for (String domain : allowedDomains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    static String hostOf(String url) {
        String rest = url.replaceFirst("(?i)^https?://", "");
        int end = rest.length();
        for (char stop : new char[] {'/', '?', '#', ':'}) {
            int index = rest.indexOf(stop);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        String host = rest.substring(0, end);
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        return host.replaceAll("[.,;!)\\]]+$", "").toLowerCase(Locale.ROOT);
    }

    private static int countDigits(String candidate) {
        int digits = 0;
        for (int i = 0; i < candidate.length(); i++) {
            if (Character.isDigit(candidate.charAt(i))) {
                digits++;
            }
        }
        return digits;
    }

    private static Pattern compileKeywords(Set<String> keywords) {
        if (keywords.isEmpty()) {
            return null;
        }
        String alternation = keywords.stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}_])(?:" + alternation + ")(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static Set<String> normalize(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static List<String> split(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.asList(csv.split(","));
    }
}
