package com.delta.siteaudit.generation.model;

import java.util.List;

public record PagePackage(
    String packageName,
    int pages,
    String purpose,
    List<String> whatAiCanDo,
    List<String> pagesToBuild
) {
    public PagePackage {
        whatAiCanDo = List.copyOf(whatAiCanDo);
        pagesToBuild = pagesToBuild == null ? List.of() : List.copyOf(pagesToBuild);
    }
}
