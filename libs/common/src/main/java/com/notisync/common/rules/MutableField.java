package com.notisync.common.rules;

/** Scalar fields a rule action can assign; the first rule to assign one keeps it. */
public enum MutableField {
  CATEGORY,
  PRIORITY,
  READ,
  DISMISSED,
  TITLE,
  BODY
}
