package com.github.wikitext.simplified;

import java.util.List;

/**
 * @param header     {@code true} for {@code !} cells
 * @param attributes cell attributes, {@code null} when absent
 */
public record TableCell(boolean header, List<Spanned<WikitextSimplifiedNode>> attributes, List<Spanned<WikitextSimplifiedNode>> content) {}
