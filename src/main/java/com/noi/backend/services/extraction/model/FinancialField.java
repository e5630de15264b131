package com.noi.backend.services.extraction.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Closed schema of real-estate operating statement fields.
 *
 * The JSON key of a field is part of the public contract: new fields may be added,
 * existing keys never change meaning.
 */
public enum FinancialField {

    GPR("gpr", "Gross Potential Rent", Group.PRIMARY, false,
            "gross potential rent", "potential rent", "scheduled rent", "gross scheduled rent",
            "gross rent", "gross rental income", "total rental income", "rental income", "rental revenue",
            "rent revenue", "total revenue", "gross income"),
    VACANCY_LOSS("vacancy_loss", "Vacancy Loss", Group.DEDUCTION, false,
            "vacancy loss", "vacancy and credit loss", "vacancy & credit loss", "vacancy", "credit loss",
            "turnover loss", "physical vacancy", "economic vacancy"),
    CONCESSIONS("concessions", "Concessions", Group.DEDUCTION, false,
            "concessions", "concession", "tenant concessions", "leasing concessions", "move-in concessions",
            "rent concessions", "free rent"),
    BAD_DEBT("bad_debt", "Bad Debt", Group.DEDUCTION, false,
            "bad debt", "bad debts", "uncollected rent", "delinquent rent", "write-offs", "write offs",
            "account receivable write-offs", "collection loss"),
    OTHER_INCOME("other_income", "Other Income", Group.INCOME_TOTAL, false,
            "other income", "total other income", "additional income", "ancillary income", "non-rental income"),
    EGI("egi", "Effective Gross Income", Group.PRIMARY, true,
            "effective gross income", "egi", "net rental income", "adjusted gross income", "total income",
            "effective income"),
    OPEX("opex", "Total Operating Expenses", Group.PRIMARY, false,
            "total operating expenses", "operating expenses", "operating expense", "opex", "total expenses",
            "operating costs", "property operating expenses", "total opex"),
    NOI("noi", "Net Operating Income", Group.PRIMARY, true,
            "net operating income", "noi", "net income", "operating income", "property net income"),

    PROPERTY_TAXES("property_taxes", "Property Taxes", Group.OPEX_COMPONENT, false,
            "property taxes", "property tax", "real estate taxes", "real estate tax", "taxes"),
    INSURANCE("insurance", "Insurance", Group.OPEX_COMPONENT, false,
            "insurance", "property insurance"),
    REPAIRS_MAINTENANCE("repairs_maintenance", "Repairs & Maintenance", Group.OPEX_COMPONENT, false,
            "repairs & maintenance", "repairs and maintenance", "repairs/maintenance", "repairs", "maintenance",
            "r&m"),
    UTILITIES("utilities", "Utilities", Group.OPEX_COMPONENT, false,
            "utilities", "utility expense", "utility"),
    MANAGEMENT_FEES("management_fees", "Management Fees", Group.OPEX_COMPONENT, false,
            "management fees", "management fee", "property management"),
    ADMINISTRATIVE("administrative", "Administrative", Group.OPEX_COMPONENT, false,
            "administrative", "general & administrative", "general and administrative", "g&a", "admin"),
    PAYROLL("payroll", "Payroll", Group.OPEX_COMPONENT, false,
            "payroll", "salaries", "wages", "salaries & wages"),
    MARKETING("marketing", "Marketing", Group.OPEX_COMPONENT, false,
            "marketing", "advertising", "marketing & advertising"),
    OTHER_EXPENSES("other_expenses", "Other Expenses", Group.OPEX_COMPONENT, false,
            "other expenses", "other operating expenses", "miscellaneous expenses", "other expense"),

    PARKING("parking", "Parking Income", Group.INCOME_COMPONENT, false,
            "parking income", "parking fees", "parking"),
    LAUNDRY("laundry", "Laundry Income", Group.INCOME_COMPONENT, false,
            "laundry income", "laundry fees", "laundry"),
    LATE_FEES("late_fees", "Late Fees", Group.INCOME_COMPONENT, false,
            "late fees", "late fee", "late charges"),
    PET_FEES("pet_fees", "Pet Fees", Group.INCOME_COMPONENT, false,
            "pet fees", "pet fee", "pet rent"),
    APPLICATION_FEES("application_fees", "Application Fees", Group.INCOME_COMPONENT, false,
            "application fees", "application fee"),
    STORAGE_FEES("storage_fees", "Storage Fees", Group.INCOME_COMPONENT, false,
            "storage fees", "storage fee", "storage income", "storage"),
    AMENITY_FEES("amenity_fees", "Amenity Fees", Group.INCOME_COMPONENT, false,
            "amenity fees", "amenity fee", "amenity income"),
    UTILITY_REIMBURSEMENTS("utility_reimbursements", "Utility Reimbursements", Group.INCOME_COMPONENT, false,
            "utility reimbursements", "utility reimbursement", "rubs", "utility recovery"),
    CLEANING_FEES("cleaning_fees", "Cleaning Fees", Group.INCOME_COMPONENT, false,
            "cleaning fees", "cleaning fee"),
    CANCELLATION_FEES("cancellation_fees", "Cancellation Fees", Group.INCOME_COMPONENT, false,
            "cancellation fees", "cancellation fee", "lease termination fees", "termination fees"),
    MISCELLANEOUS("miscellaneous", "Miscellaneous Income", Group.INCOME_COMPONENT, false,
            "miscellaneous income", "misc income", "miscellaneous", "misc");

    public enum Group {
        PRIMARY,
        DEDUCTION,
        INCOME_TOTAL,
        OPEX_COMPONENT,
        INCOME_COMPONENT
    }

    /** Metrics whose confidence decides the overall level. */
    public static final Set<FinancialField> PRIMARY_METRICS =
            Collections.unmodifiableSet(EnumSet.of(GPR, EGI, OPEX, NOI));

    private static final Map<String, FinancialField> BY_ALIAS = buildAliasIndex();

    private final String key;
    private final String label;
    private final Group group;
    private final boolean signed;
    private final List<String> synonyms;

    FinancialField(String key, String label, Group group, boolean signed, String... synonyms) {
        this.key = key;
        this.label = label;
        this.group = group;
        this.signed = signed;
        this.synonyms = List.of(synonyms);
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public Group getGroup() {
        return group;
    }

    /** Signed fields keep negative values; all others are stored as magnitudes. */
    public boolean isSigned() {
        return signed;
    }

    public List<String> getSynonyms() {
        return synonyms;
    }

    public boolean isPrimary() {
        return PRIMARY_METRICS.contains(this);
    }

    public static List<FinancialField> opexComponents() {
        return byGroup(Group.OPEX_COMPONENT);
    }

    public static List<FinancialField> incomeComponents() {
        return byGroup(Group.INCOME_COMPONENT);
    }

    private static List<FinancialField> byGroup(Group group) {
        List<FinancialField> out = new ArrayList<>();
        for (FinancialField f : values()) {
            if (f.group == group) out.add(f);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Resolves a JSON key or label variant ("gross_potential_rent", "Property Tax", "parking_income")
     * to its canonical field. Returns null for unknown names.
     */
    public static FinancialField fromAlias(String name) {
        if (name == null) return null;
        return BY_ALIAS.get(aliasKey(name));
    }

    static String aliasKey(String name) {
        return name.trim()
                .toLowerCase(Locale.ROOT)
                .replace("&", " and ")
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }

    private static Map<String, FinancialField> buildAliasIndex() {
        Map<String, FinancialField> index = new LinkedHashMap<>();
        for (FinancialField f : values()) {
            index.put(f.key, f);
            index.put(aliasKey(f.label), f);
        }
        for (FinancialField f : values()) {
            for (String synonym : f.synonyms) {
                index.putIfAbsent(aliasKey(synonym), f);
            }
        }
        // JSON spellings seen in model output that are not label synonyms.
        Map<String, FinancialField> extra = new LinkedHashMap<>();
        extra.put("operating_expenses", OPEX);
        extra.put("expenses_total", OPEX);
        extra.put("effective_gross_income", EGI);
        extra.put("net_operating_income", NOI);
        extra.put("gross_potential_rent", GPR);
        extra.put("repairs_and_maintenance", REPAIRS_MAINTENANCE);
        extra.put("miscellaneous_income", MISCELLANEOUS);
        extra.put("parking_income", PARKING);
        extra.put("laundry_income", LAUNDRY);
        extra.put("total_operating_expenses", OPEX);
        for (Map.Entry<String, FinancialField> e : extra.entrySet()) {
            index.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(index);
    }

    public static List<FinancialField> ordered() {
        return Arrays.asList(values());
    }
}
