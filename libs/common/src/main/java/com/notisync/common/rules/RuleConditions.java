package com.notisync.common.rules;

/**
 * Condition payload of a rule. The variant is selected by the owning rule's {@link RuleType};
 * {@link RuleCodec} decodes it with an explicit switch on that type.
 */
public sealed interface RuleConditions
    permits AppFilterConditions,
        KeywordFilterConditions,
        TimeBasedConditions,
        OtpAlwaysConditions,
        PromoMuteConditions,
        FieldConditions {

  RuleType ruleType();
}
