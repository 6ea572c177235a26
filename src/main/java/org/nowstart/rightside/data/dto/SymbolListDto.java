package org.nowstart.rightside.data.dto;

import java.util.List;

public record SymbolListDto(List<String> symbols) {
}
