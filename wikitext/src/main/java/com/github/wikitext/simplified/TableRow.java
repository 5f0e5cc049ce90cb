package com.github.wikitext.simplified;

import java.util.List;

public record TableRow(List<Spanned<WikitextSimplifiedNode>> attributes, List<TableCell> cells) {}
