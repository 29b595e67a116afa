/**
 * Ready-made checks built on {@link com.fluentchecks.core.CustomCheck}: filesystem
 * existence and content ({@link com.fluentchecks.predicates.FileChecks}) and value
 * comparisons ({@link com.fluentchecks.predicates.ComparisonChecks}).
 */
package com.fluentchecks.predicates;
