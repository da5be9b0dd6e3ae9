package org.onionscout.analysis;

import org.onionscout.util.Address;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides which discovered addresses are worth crawling: the host must be on the anonymity network and the path
 * must not name a static asset.
 */
public class NetworkScope implements Predicate<Address> {
    private final List<String> suffixes;
    private final Set<String> ignoredExtensions;

    public NetworkScope(List<String> suffixes, List<String> ignoredExtensions) {
        if (suffixes.isEmpty()) throw new IllegalArgumentException("at least one network suffix is required");
        this.suffixes = List.copyOf(suffixes);
        this.ignoredExtensions = ignoredExtensions.stream()
                .map(extension -> extension.startsWith(".") ? extension : "." + extension)
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static NetworkScope onion() {
        return new NetworkScope(List.of(".onion"), List.of());
    }

    public boolean onNetwork(Address address) {
        for (String suffix : suffixes) {
            if (address.hasHostSuffix(suffix)) return true;
        }
        return false;
    }

    public List<String> suffixes() {
        return suffixes;
    }

    @Override
    public boolean test(Address address) {
        return onNetwork(address) && !ignoredExtensions.contains(address.extension());
    }
}
