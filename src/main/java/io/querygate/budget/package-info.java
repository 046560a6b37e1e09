/**
 * Rolling one-hour scan budgets per tenant.
 */
package io.querygate.budget;
