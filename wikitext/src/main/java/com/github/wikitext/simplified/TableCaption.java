package com.github.wikitext.simplified;

import java.util.List;

/**
 * @param attributes caption attributes, {@code null} when absent
 */
public record TableCaption(List<Spanned<WikitextSimplifiedNode>> attributes, List<Spanned<WikitextSimplifiedNode>> content) {}
