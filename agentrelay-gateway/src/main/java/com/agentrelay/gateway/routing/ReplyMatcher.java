package com.agentrelay.gateway.routing;

import com.agentrelay.gateway.backend.QuestionRequest;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes replies that resolve a pending approval or question.
 *
 * <p>
 * Approvals accept the button data {@code approve:<id>} / {@code deny:<id>} or a single
 * yes/no word; only {@code deny} may carry a reason after it. Questions accept
 * {@code q:<id>:<n>}, a bare option number (1-based) or an option label, case-insensitively.
 * Anything else does not match and is routed as a normal message, except button data whose
 * request is no longer pending (see {@link #isButtonData}).
 * </p>
 */
public final class ReplyMatcher {

    private ReplyMatcher() {
    }

    private static final Set<String> APPROVE_WORDS = Set.of("yes", "y", "approve", "allow", "ok");
    private static final Set<String> DENY_WORDS = Set.of("no", "n", "deny", "reject");
    private static final Pattern DENY_WITH_REASON = Pattern.compile("^deny\\s+(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NUMBER = Pattern.compile("^\\d{1,3}$");
    private static final Pattern BUTTON_DATA = Pattern.compile("^(?:(?:approve|deny):[0-9a-f]{8}|q:[0-9a-f]{8}:\\d{1,3})$",
            Pattern.CASE_INSENSITIVE);

    public record ApprovalReply(boolean approved, String reason) {
    }

    public static String approveData(String requestId) {
        return "approve:" + requestId;
    }

    public static String denyData(String requestId) {
        return "deny:" + requestId;
    }

    /**
     * @param index zero-based option index
     */
    public static String questionData(String requestId, int index) {
        return "q:" + requestId + ":" + (index + 1);
    }

    public static Optional<ApprovalReply> matchApproval(String body, String requestId) {
        if (body == null) {
            return Optional.empty();
        }
        String text = body.trim();
        if (text.equalsIgnoreCase(approveData(requestId))) {
            return Optional.of(new ApprovalReply(true, null));
        }
        if (text.equalsIgnoreCase(denyData(requestId))) {
            return Optional.of(new ApprovalReply(false, null));
        }
        String word = stripTrailingPunctuation(text).toLowerCase(Locale.ROOT);
        if (APPROVE_WORDS.contains(word)) {
            return Optional.of(new ApprovalReply(true, null));
        }
        if (DENY_WORDS.contains(word)) {
            return Optional.of(new ApprovalReply(false, null));
        }
        Matcher m = DENY_WITH_REASON.matcher(text);
        if (m.matches()) {
            return Optional.of(new ApprovalReply(false, m.group(1).trim()));
        }
        return Optional.empty();
    }

    /**
     * @return the zero-based index of the chosen option, or empty if the reply does not choose one
     */
    public static OptionalInt matchQuestion(String body, String requestId, List<QuestionRequest.Option> options) {
        if (body == null || options == null || options.isEmpty()) {
            return OptionalInt.empty();
        }
        String text = body.trim();
        String prefix = "q:" + requestId + ":";
        if (text.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return checkedIndex(text.substring(prefix.length()), options.size());
        }
        if (NUMBER.matcher(text).matches()) {
            return checkedIndex(text, options.size());
        }
        String candidate = stripTrailingPunctuation(text);
        for (int i = 0; i < options.size(); i++) {
            String label = options.get(i).label();
            if (label != null && label.trim().equalsIgnoreCase(candidate)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * True for the callback data of an approval or question button, whatever its request id.
     */
    public static boolean isButtonData(String body) {
        return body != null && BUTTON_DATA.matcher(body.trim()).matches();
    }

    private static OptionalInt checkedIndex(String raw, int size) {
        if (!NUMBER.matcher(raw).matches()) {
            return OptionalInt.empty();
        }
        int n = Integer.parseInt(raw);
        return n >= 1 && n <= size ? OptionalInt.of(n - 1) : OptionalInt.empty();
    }

    private static String stripTrailingPunctuation(String text) {
        int end = text.length();
        while (end > 0 && ".!".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(0, end).trim();
    }
}
