package jump.email.sorter.entity;

import lombok.Value;

@Value
public class RuleStats {
    int totalCorrections;
    int senderRules;
    int domainRules;
    int subjectKeywords;
    int categoriesLearned;
}
