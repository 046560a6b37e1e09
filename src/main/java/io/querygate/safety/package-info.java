/**
 * Static SQL checks. Nothing here talks to a database; statements are tokenized and judged on their
 * structure alone.
 */
package io.querygate.safety;
