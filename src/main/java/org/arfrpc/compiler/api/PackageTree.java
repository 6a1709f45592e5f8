package org.arfrpc.compiler.api;

import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.frontend.parser.ast.ServiceNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything declared in one package, aggregated over all files declaring it.
 * Services declared in several files appear once, with the methods of every block.
 */
public final class PackageTree {

    private final String name;
    private final List<FileNode> files = new ArrayList<>();
    private final List<StructNode> structs = new ArrayList<>();
    private final List<EnumNode> enums = new ArrayList<>();
    private final Map<String, ServiceNode> services = new LinkedHashMap<>();
    private final List<ImportNode> imports = new ArrayList<>();

    PackageTree(String name) {
        this.name = name;
    }

    void add(FileNode file) {
        files.add(file);
        structs.addAll(file.structs());
        enums.addAll(file.enums());
        imports.addAll(file.imports());
        for (ServiceNode service : file.services()) {
            ServiceNode existing = services.get(service.name().text());
            if (existing == null) {
                services.put(service.name().text(), service.copy());
            } else {
                existing.reopen(service);
            }
        }
    }

    public String name() {
        return name;
    }

    public List<FileNode> files() {
        return List.copyOf(files);
    }

    public List<StructNode> structs() {
        return List.copyOf(structs);
    }

    public List<EnumNode> enums() {
        return List.copyOf(enums);
    }

    public List<ServiceNode> services() {
        return List.copyOf(services.values());
    }

    public List<ImportNode> imports() {
        return List.copyOf(imports);
    }

    public Optional<StructNode> findStruct(String structName) {
        return structs.stream().filter(s -> s.name().text().equals(structName)).findFirst();
    }

    public Optional<EnumNode> findEnum(String enumName) {
        return enums.stream().filter(e -> e.name().text().equals(enumName)).findFirst();
    }

    public Optional<ServiceNode> findService(String serviceName) {
        return Optional.ofNullable(services.get(serviceName));
    }
}
