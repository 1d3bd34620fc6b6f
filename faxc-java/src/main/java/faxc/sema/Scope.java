package faxc.sema;

import java.util.HashSet;
import java.util.Set;

/** One lexical level: the mangled names declared directly in it. */
public final class Scope {
    private final Set<String> names = new HashSet<>();

    public void define(String mangled) {
        // повторное объявление не ошибка: проверка типов была раньше
        names.add(mangled);
    }

    public boolean has(String mangled) {
        return names.contains(mangled);
    }
}
