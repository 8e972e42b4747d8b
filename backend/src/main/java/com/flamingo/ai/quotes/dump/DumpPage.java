package com.flamingo.ai.quotes.dump;

/**
 * One page of a dump.
 *
 * @param title the page title
 * @param redirect whether the page only redirects to another page
 * @param rawContent wikitext of the last revision, empty when the page has none
 */
public record DumpPage(String title, boolean redirect, String rawContent) {}
