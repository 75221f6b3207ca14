package no.cantara.ucca.refine;

import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.AbstractionLevel;
import no.cantara.ucca.model.ActionRequirement;
import no.cantara.ucca.model.Controller;
import no.cantara.ucca.model.ControllerAssignment;
import no.cantara.ucca.model.GenerationMode;
import no.cantara.ucca.model.UCCARefinementConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Produces candidate controller-to-action assignment sets for an abstract UCCA.
 *
 * <p>Candidates are enumerated lazily from a {@link CandidateSpace} whose size is known up front,
 * so an oversized space is refused before anything is allocated.
 *
 * <p>Team-level (2a): every non-set requirement binds one controller from its pool, and each
 * "any of" member is an alternative that binds one more. Controller-specific (2b): every involved
 * controller with authority is bound to each required action, and a required action none of them
 * holds authority for adds nothing; negated actions are asserted for the involved controllers that
 * could provide them, or for all involved controllers if none could.
 */
public class CombinationGenerator {

    private final AuthorityIndex authority;
    private final List<String> controllerOrder;
    private final boolean includePartialAuthority;
    private final GenerationMode mode;

    public CombinationGenerator(AuthorityIndex authority, List<Controller> controllers, UCCARefinementConfig config) {
        this.authority = authority;
        this.controllerOrder = controllers.stream().map(Controller::id).toList();
        this.includePartialAuthority = config.includePartialAuthority();
        this.mode = config.generationMode();
    }

    public GenerationMode mode() {
        return mode;
    }

    /**
     * @throws CombinationLimitExceededException if the space holds more than {@code limit} candidates
     */
    public CandidateSpace candidates(AbstractUCCA abstractUCCA, List<ActionRequirement> requirements, int limit)
            throws CombinationLimitExceededException {
        CandidateSpace space = abstractUCCA.abstractionLevel() == AbstractionLevel.TEAM_LEVEL
                ? teamLevel(requirements)
                : controllerSpecific(abstractUCCA.involvedControllerIds(), requirements);
        if (space.size() > limit) {
            throw new CombinationLimitExceededException(abstractUCCA.id(), space.size(), limit);
        }
        return space;
    }

    CandidateSpace teamLevel(List<ActionRequirement> requirements) {
        List<Slot> base = new ArrayList<>();
        List<Slot> alternatives = new ArrayList<>();
        for (ActionRequirement req : requirements) {
            List<String> pool = pool(req.controlActionId());
            if (req.isFromSet()) {
                if (!pool.isEmpty()) alternatives.add(new Slot(req.controlActionId(), true, pool));
            } else if (pool.isEmpty()) {
                // nobody can provide a negated action, so it holds trivially
                if (req.required()) return CandidateSpace.EMPTY;
            } else {
                base.add(new Slot(req.controlActionId(), req.required(), pool));
            }
        }
        boolean hasSet = requirements.stream().anyMatch(ActionRequirement::isFromSet);
        if (hasSet && alternatives.isEmpty()) return CandidateSpace.EMPTY;

        if (mode == GenerationMode.REPRESENTATIVE) {
            List<Slot> all = new ArrayList<>(base);
            all.addAll(alternatives);
            List<Slot> firstOnly = all.stream().map(Slot::firstOnly).toList();
            return firstOnly.isEmpty() ? CandidateSpace.EMPTY : CandidateSpace.ofSlots(List.of(firstOnly));
        }

        if (alternatives.isEmpty()) {
            return base.isEmpty() ? CandidateSpace.EMPTY : CandidateSpace.ofSlots(List.of(base));
        }
        List<List<Slot>> subspaces = new ArrayList<>();
        for (Slot alternative : alternatives) {
            List<Slot> slots = new ArrayList<>(base);
            slots.add(alternative);
            subspaces.add(slots);
        }
        return CandidateSpace.ofSlots(subspaces);
    }

    CandidateSpace controllerSpecific(List<String> involved, List<ActionRequirement> requirements) {
        if (involved.isEmpty()) return CandidateSpace.EMPTY;

        List<ControllerAssignment> base = new ArrayList<>();
        List<List<ControllerAssignment>> alternatives = new ArrayList<>();
        for (ActionRequirement req : requirements) {
            String action = req.controlActionId();
            List<String> authorized = involved.stream().filter(c -> authority.hasAuthority(c, action)).toList();
            if (req.isFromSet()) {
                if (!authorized.isEmpty()) {
                    alternatives.add(authorized.stream().map(c -> ControllerAssignment.provides(c, action)).toList());
                }
            } else if (req.required()) {
                authorized.forEach(c -> base.add(ControllerAssignment.provides(c, action)));
            } else {
                List<String> asserted = authorized.isEmpty() ? involved : authorized;
                asserted.forEach(c -> base.add(ControllerAssignment.doesNotProvide(c, action)));
            }
        }
        boolean hasSet = requirements.stream().anyMatch(ActionRequirement::isFromSet);
        if (hasSet && alternatives.isEmpty()) return CandidateSpace.EMPTY;

        List<List<ControllerAssignment>> candidates = new ArrayList<>();
        if (alternatives.isEmpty()) {
            if (!base.isEmpty()) candidates.add(List.copyOf(base));
        } else if (mode == GenerationMode.REPRESENTATIVE) {
            List<ControllerAssignment> all = new ArrayList<>(base);
            alternatives.forEach(all::addAll);
            candidates.add(List.copyOf(all));
        } else {
            for (List<ControllerAssignment> alternative : alternatives) {
                List<ControllerAssignment> candidate = new ArrayList<>(base);
                candidate.addAll(alternative);
                candidates.add(List.copyOf(candidate));
            }
        }
        return CandidateSpace.of(candidates);
    }

    /**
     * Controllers that may be bound to an action: those with affirmative authority, in reference
     * controller order, plus undeclared ones when partial authority is tolerated.
     */
    private List<String> pool(String controlActionId) {
        Set<String> authorized = new LinkedHashSet<>(authority.authorizedControllers(controlActionId));
        List<String> pool = new ArrayList<>();
        for (String id : controllerOrder) {
            if (authorized.remove(id)) {
                pool.add(id);
            } else if (includePartialAuthority && !authority.isDeclared(id, controlActionId)) {
                pool.add(id);
            }
        }
        pool.addAll(authorized);
        return pool;
    }

    /** One requirement bound to a choice from {@code pool}. */
    record Slot(String controlActionId, boolean performed, List<String> pool) {
        Slot firstOnly() {
            return new Slot(controlActionId, performed, List.of(pool.get(0)));
        }

        ControllerAssignment bind(int choice) {
            return new ControllerAssignment(pool.get(choice), controlActionId, performed);
        }
    }

    /**
     * A finite, restartable sequence of candidate assignment sets: the concatenation of the cross
     * products of each subspace's slots.
     */
    public static final class CandidateSpace implements Iterable<List<ControllerAssignment>> {

        static final CandidateSpace EMPTY = new CandidateSpace(List.of(), null);

        private final List<List<Slot>> subspaces;
        private final List<List<ControllerAssignment>> fixed;
        private final long size;

        private CandidateSpace(List<List<Slot>> subspaces, List<List<ControllerAssignment>> fixed) {
            this.subspaces = List.copyOf(subspaces);
            this.fixed = fixed != null ? List.copyOf(fixed) : null;
            if (fixed != null) {
                this.size = fixed.size();
            } else {
                long total = 0;
                for (List<Slot> slots : this.subspaces) {
                    total = saturatedAdd(total, product(slots));
                }
                this.size = total;
            }
        }

        static CandidateSpace ofSlots(List<List<Slot>> subspaces) {
            return subspaces.isEmpty() ? EMPTY : new CandidateSpace(subspaces, null);
        }

        static CandidateSpace of(List<List<ControllerAssignment>> candidates) {
            return candidates.isEmpty() ? EMPTY : new CandidateSpace(List.of(), candidates);
        }

        /** Number of candidates; {@link Long#MAX_VALUE} if it does not fit in a long. */
        public long size() {
            return size;
        }

        public boolean isEmpty() {
            return size == 0;
        }

        @Override
        public Iterator<List<ControllerAssignment>> iterator() {
            if (fixed != null) return fixed.iterator();
            if (subspaces.isEmpty()) return Collections.emptyIterator();
            return new Iterator<>() {
                private int current = 0;
                private Odometer odometer = new Odometer(subspaces.get(0));

                @Override
                public boolean hasNext() {
                    while (!odometer.hasNext() && current + 1 < subspaces.size()) {
                        odometer = new Odometer(subspaces.get(++current));
                    }
                    return odometer.hasNext();
                }

                @Override
                public List<ControllerAssignment> next() {
                    if (!hasNext()) throw new NoSuchElementException();
                    return odometer.next();
                }
            };
        }

        private static long product(List<Slot> slots) {
            if (slots.isEmpty()) return 0;
            long product = 1;
            for (Slot slot : slots) {
                try {
                    product = Math.multiplyExact(product, slot.pool().size());
                } catch (ArithmeticException e) {
                    return Long.MAX_VALUE;
                }
            }
            return product;
        }

        private static long saturatedAdd(long a, long b) {
            long sum = a + b;
            return sum < 0 ? Long.MAX_VALUE : sum;
        }
    }

    /** Mixed-radix counter over slot choices; the last slot varies fastest. */
    private static final class Odometer implements Iterator<List<ControllerAssignment>> {

        private final List<Slot> slots;
        private final int[] digits;
        private boolean exhausted;

        Odometer(List<Slot> slots) {
            this.slots = slots;
            this.digits = new int[slots.size()];
            this.exhausted = slots.isEmpty() || slots.stream().anyMatch(s -> s.pool().isEmpty());
        }

        @Override
        public boolean hasNext() {
            return !exhausted;
        }

        @Override
        public List<ControllerAssignment> next() {
            if (exhausted) throw new NoSuchElementException();
            List<ControllerAssignment> candidate = new ArrayList<>(slots.size());
            for (int i = 0; i < slots.size(); i++) {
                candidate.add(slots.get(i).bind(digits[i]));
            }
            int i = slots.size() - 1;
            while (i >= 0) {
                if (++digits[i] < slots.get(i).pool().size()) break;
                digits[i] = 0;
                i--;
            }
            if (i < 0) exhausted = true;
            return List.copyOf(candidate);
        }
    }
}
