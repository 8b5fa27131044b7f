package com.orderline.resolution.pricing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link PricingRuleStore}. Saving a rule with an existing id replaces it.
 */
public class InMemoryPricingRuleStore implements PricingRuleStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPricingRuleStore.class);

    private final List<PricingRule> rules = new CopyOnWriteArrayList<>();

    public InMemoryPricingRuleStore() {
    }

    public InMemoryPricingRuleStore(Collection<PricingRule> initial) {
        initial.forEach(this::save);
    }

    @Override
    public Optional<PricingRule> findEffective(String customerSegment, LocalDate date) {
        String segment = customerSegment.toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(r -> r.getCustomerSegment().equals(segment))
                .filter(r -> r.isEffective(date))
                .max(Comparator.comparing(PricingRule::getEffectiveFrom));
    }

    @Override
    public List<PricingRule> findAll() {
        return List.copyOf(rules);
    }

    @Override
    public synchronized void save(PricingRule rule) {
        rules.removeIf(r -> r.getId().equals(rule.getId()));
        rules.add(rule);
        log.debug("pricing.rule.saved id={} segment={} baseMarkup={}",
                rule.getId(), rule.getCustomerSegment(), rule.getBaseMarkupPct());
    }
}
