package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;
import com.rtops.domain.TacticGroup;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read side of the catalog used by the browser, plan builder and report screens.
 */
@Service
public class CatalogQueryService {
    
    private static final Comparator<CatalogRecord> BY_NAME_THEN_ID = Comparator
        .comparing((CatalogRecord record) -> displayName(record).toLowerCase(Locale.ROOT))
        .thenComparing(CatalogRecord::getTechniqueId);
    
    private final CatalogStore store;
    
    public CatalogQueryService(CatalogStore store) {
        this.store = store;
    }
    
    /**
     * List the catalog grouped by tactic in kill-chain order.
     * 
     * Every registry tactic gets a group, empty or not. Within a group records
     * are sorted by name, then technique id. A non-blank query keeps only
     * records whose name, technique id or tactic id contains it, ignoring case.
     * 
     * @param query free-text filter, may be null
     * @return one group per tactic
     */
    public List<TacticGroup> listGroupedByTactic(String query) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        
        Map<Tactic, List<CatalogRecord>> byTactic = new EnumMap<>(Tactic.class);
        for (CatalogRecord record : store.findAll()) {
            if (record.getTactic() == null || !matches(record, needle)) {
                continue;
            }
            byTactic.computeIfAbsent(record.getTactic(), t -> new ArrayList<>()).add(record);
        }
        
        List<TacticGroup> groups = new ArrayList<>(Tactic.values().length);
        for (Tactic tactic : Tactic.values()) {
            List<CatalogRecord> records = byTactic.getOrDefault(tactic, new ArrayList<>());
            records.sort(BY_NAME_THEN_ID);
            groups.add(new TacticGroup(tactic, records));
        }
        return groups;
    }
    
    public CatalogStatus getStatus() {
        return new CatalogStatus(store.isPopulated(), store.count());
    }
    
    private static boolean matches(CatalogRecord record, String needle) {
        if (needle.isEmpty()) {
            return true;
        }
        return contains(record.getName(), needle)
            || contains(record.getTechniqueId(), needle)
            || record.getTactic().getId().contains(needle);
    }
    
    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
    
    private static String displayName(CatalogRecord record) {
        String name = record.getName();
        return name == null || name.isBlank() ? record.getTechniqueId() : name;
    }
}
