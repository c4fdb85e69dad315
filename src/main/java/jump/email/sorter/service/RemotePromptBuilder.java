package jump.email.sorter.service;

import jump.email.sorter.entity.Category;
import jump.email.sorter.entity.Correction;
import jump.email.sorter.entity.LearnedRules;
import jump.email.sorter.entity.RemotePrompt;
import jump.email.sorter.entity.RemoteRequestItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the batch classification prompt. Message text is sanitised before it is embedded so a
 * subject cannot close its own quoting or spill into the next message.
 */
@Component
public class RemotePromptBuilder {
    static final int MAX_SUBJECT_LENGTH = 100;
    static final int MAX_BODY_LENGTH = 300;
    private static final int MAX_RULES_PER_KIND = 3;
    private static final int EXAMPLE_SUBJECT_LENGTH = 50;
    private static final Pattern QUOTES = Pattern.compile("[\"'`]");
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n\\t]+");
    private static final Pattern SPACES = Pattern.compile(" {2,}");

    public RemotePrompt build(List<RemoteRequestItem> items, List<Category> categories,
                              List<Correction> examples, LearnedRules rules) {
        StringBuilder names = new StringBuilder();
        StringBuilder descriptions = new StringBuilder();
        for (Category category : categories) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(category.getName());
            descriptions.append(String.format("- %s: %s%n", category.getName(),
                category.getDescription() == null ? "" : category.getDescription()));
        }

        StringBuilder prompt = new StringBuilder();
        if (!examples.isEmpty()) {
            prompt.append("Here are examples of past user corrections you should learn from:\n");
            int number = 1;
            for (Correction example : examples) {
                prompt.append(String.format("Example %d: Subject=%s, From=%s, Correct Category=%s%n",
                    number++, sanitize(example.getSubject(), EXAMPLE_SUBJECT_LENGTH),
                    sanitize(example.getSender(), MAX_SUBJECT_LENGTH), example.getCorrectCategory()));
            }
            prompt.append('\n');
        }
        appendRules(prompt, rules);

        prompt.append(String.format("Classify these %d emails into categories:%n%s%n", items.size(), descriptions));
        for (int index = 0; index < items.size(); index++) {
            RemoteRequestItem item = items.get(index);
            prompt.append(String.format("Email %d (email_id: %s):%nSubject: %s%nBody: %s%n%n", index, item.getId(),
                sanitize(item.getSubject(), MAX_SUBJECT_LENGTH), sanitize(item.getBody(), MAX_BODY_LENGTH)));
        }
        prompt.append("Return ONLY a JSON array with this format:\n")
            .append("[\n")
            .append("  {\"email_index\": 0, \"email_id\": \"ID\", \"category\": \"CATEGORY_NAME\", \"confidence\": 0.9, \"explanation\": \"reason\"}\n")
            .append("]\n\n")
            .append("RULES:\n")
            .append("1. ONLY use these categories: ").append(names).append('\n')
            .append("2. Return ALL emails in order (0 to ").append(items.size() - 1).append(")\n")
            .append("3. Output MUST be a valid JSON array");

        String system = "Email classifier. Valid categories: " + names + ". Output JSON only.";
        return new RemotePrompt(system, prompt.toString());
    }

    private void appendRules(StringBuilder prompt, LearnedRules rules) {
        if (rules == null || (rules.getSenderRules().isEmpty() && rules.getDomainRules().isEmpty())) {
            return;
        }
        prompt.append("Important rules learned from user behavior:\n");
        appendRuleKind(prompt, "Sender-specific rules:", rules.getSenderRules());
        appendRuleKind(prompt, "Domain-specific rules:", rules.getDomainRules());
        prompt.append('\n');
    }

    private void appendRuleKind(StringBuilder prompt, String title, Map<String, String> table) {
        if (table.isEmpty()) {
            return;
        }
        prompt.append("- ").append(title).append('\n');
        table.entrySet().stream().limit(MAX_RULES_PER_KIND).forEach(rule ->
            prompt.append(String.format("  * Emails from %s should be categorized as %s%n",
                sanitize(rule.getKey(), MAX_SUBJECT_LENGTH), rule.getValue())));
    }

    /**
     * Strip quote characters, fold line breaks into single spaces and truncate.
     */
    public static String sanitize(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String value = QUOTES.matcher(text).replaceAll("");
        value = LINE_BREAKS.matcher(value).replaceAll(" ");
        value = SPACES.matcher(value).replaceAll(" ").trim();
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
