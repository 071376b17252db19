package com.idl.compiler.compile;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * A compiled enum. Holds no references, so linking only marks it linked.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class EnumSpec extends LinkableSpec implements TypeSpec {

    @NonNull
    private final String name;

    @NonNull
    private final List<EnumItemSpec> items;

    public EnumSpec(@NonNull String name, @NonNull List<EnumItemSpec> items) {
        this.name = name;
        this.items = List.copyOf(items);
    }

    @Override
    public String getThriftName() {
        return name;
    }

    public Optional<EnumItemSpec> findItem(String itemName) {
        return items.stream()
                .filter(item -> item.getName().equals(itemName))
                .findFirst();
    }

    @Override
    public EnumSpec link(Scope scope) {
        linkOnce(scope);
        return this;
    }

    @Override
    protected void doLink(Scope scope) {
        // nothing to resolve
    }
}
