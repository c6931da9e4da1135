/**
 * Rule table and pipeline execution.
 * <p>A {@link com.mimecast.warden.rules.Rule} pairs a compiled filter with ordered
 * <br>{@link com.mimecast.warden.rules.HandlerStep} values; the {@link com.mimecast.warden.rules.RuleEngine}
 * <br>runs them once per wake-up.
 */
package com.mimecast.warden.rules;
