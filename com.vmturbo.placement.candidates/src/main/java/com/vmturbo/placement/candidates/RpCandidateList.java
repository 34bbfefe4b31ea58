package com.vmturbo.placement.candidates;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * The resource providers nominated for an allocation candidate request, as a set of
 * {@link RpCandidate}s: (provider UUID, root provider UUID, resource class name).
 *
 * <p>A candidate resolver builds one list per requested resource class and then folds them
 * together with {@link #mergeCommonTrees(RpCandidateList)}, so that only the trees able to
 * supply every requested class survive.</p>
 *
 * <p>Every mutator replaces the underlying set rather than changing it, and the views return
 * immutable snapshots. Two lists never share mutable state.</p>
 */
@NotThreadSafe
public class RpCandidateList {

    private ImmutableSet<RpCandidate> candidates;

    /**
     * Create an empty list.
     */
    public RpCandidateList() {
        this(ImmutableSet.of());
    }

    /**
     * Create a list holding some candidates.
     *
     * @param candidates The candidates. Duplicates collapse.
     */
    public RpCandidateList(@Nonnull final Collection<RpCandidate> candidates) {
        this.candidates = ImmutableSet.copyOf(candidates);
    }

    /**
     * Get the number of candidates.
     *
     * @return The number of (provider, root, resource class) triples.
     */
    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    /**
     * Merge another list into this one, keeping only the trees that appear in both.
     *
     * <ul>
     *     <li>If this list is empty it takes on the other list's candidates. This is how the
     *     first resource class of a request gets in.</li>
     *     <li>If the other list is empty this list is unchanged.</li>
     *     <li>Otherwise the result is the union of both lists, restricted to the trees present
     *     in both. Every candidate of a surviving tree is kept, whichever list it came from,
     *     because a tree may supply one class from one provider and another class from a
     *     different provider.</li>
     * </ul>
     *
     * @param other The list to merge in. Not modified.
     */
    public void mergeCommonTrees(@Nonnull final RpCandidateList other) {
        if (isEmpty()) {
            candidates = other.candidates;
        } else if (!other.isEmpty()) {
            final Set<String> treesInBoth = Sets.intersection(getTrees(), other.getTrees())
                    .immutableCopy();
            candidates = ImmutableSet.<RpCandidate>builder()
                    .addAll(candidates)
                    .addAll(other.candidates)
                    .build();
            filterByTree(treesInBoth);
        }
    }

    /**
     * Nominate resource providers for a resource class.
     *
     * @param providers The providers, each with the root of its tree.
     * @param resourceClass The name of the resource class the providers can supply.
     */
    public void addRps(@Nonnull final Collection<ProviderRef> providers,
                       @Nonnull final String resourceClass) {
        final ImmutableSet.Builder<RpCandidate> builder = ImmutableSet.<RpCandidate>builder()
                .addAll(candidates);
        providers.forEach(provider -> builder.add(
                new RpCandidate(provider.getUuid(), provider.getRootUuid(), resourceClass)));
        candidates = builder.build();
    }

    /**
     * Keep only candidates in the given trees.
     *
     * @param rootUuids The UUIDs of the root providers of the trees to keep.
     */
    public void filterByTree(@Nonnull final Set<String> rootUuids) {
        retain(candidate -> rootUuids.contains(candidate.getRootUuid()));
    }

    /**
     * Keep only candidates whose exact (provider, root) pair is given.
     *
     * @param providers The providers to keep.
     */
    public void filterByRp(@Nonnull final Set<ProviderRef> providers) {
        retain(candidate -> providers.contains(candidate.toProviderRef()));
    }

    /**
     * Keep a candidate if either the provider itself or the root of its tree is one of the
     * given providers.
     *
     * @param providerUuids The provider UUIDs.
     */
    public void filterByRpOrTree(@Nonnull final Set<String> providerUuids) {
        retain(candidate -> inProviderOrTree(candidate, providerUuids));
    }

    /**
     * Drop a candidate if either the provider itself or the root of its tree is one of the
     * given providers. The complement of {@link #filterByRpOrTree(Set)}.
     *
     * @param providerUuids The provider UUIDs.
     */
    public void filterByRpNorTree(@Nonnull final Set<String> providerUuids) {
        retain(candidate -> !inProviderOrTree(candidate, providerUuids));
    }

    private static boolean inProviderOrTree(@Nonnull final RpCandidate candidate,
                                            @Nonnull final Set<String> providerUuids) {
        return providerUuids.contains(candidate.getUuid())
                || providerUuids.contains(candidate.getRootUuid());
    }

    private void retain(@Nonnull final Predicate<RpCandidate> predicate) {
        candidates = candidates.stream()
                .filter(predicate)
                .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Get the UUIDs of the nominated providers.
     *
     * @return The provider UUIDs.
     */
    @Nonnull
    public ImmutableSet<String> getRps() {
        return candidates.stream()
                .map(RpCandidate::getUuid)
                .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Get the nominated trees, each identified by the UUID of its root provider.
     *
     * @return The root provider UUIDs.
     */
    @Nonnull
    public ImmutableSet<String> getTrees() {
        return candidates.stream()
                .map(RpCandidate::getRootUuid)
                .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Get every provider involved, whether nominated directly or as the root of a nominated
     * provider's tree.
     *
     * @return The union of {@link #getRps()} and {@link #getTrees()}.
     */
    @Nonnull
    public ImmutableSet<String> getAllRps() {
        return Sets.union(getRps(), getTrees()).immutableCopy();
    }

    /**
     * Get the candidates themselves.
     *
     * @return The (provider, root, resource class) triples.
     */
    @Nonnull
    public ImmutableSet<RpCandidate> getRpsInfo() {
        return candidates;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RpCandidateList)) {
            return false;
        }
        return candidates.equals(((RpCandidateList)o).candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidates);
    }

    @Override
    public String toString() {
        return "RpCandidateList" + candidates;
    }
}
