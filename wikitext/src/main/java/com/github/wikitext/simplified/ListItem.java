package com.github.wikitext.simplified;

import java.util.List;

public record ListItem(List<Spanned<WikitextSimplifiedNode>> content) {}
