package com.salesBoard.biAgent.resilience.normalizer;

/**
 * Process-wide canonical vocabularies for sectors, deal stages and work-order statuses.
 */
public final class Vocabularies {

    public static final String LEAD = "Lead";
    public static final String QUALIFIED = "Qualified";
    public static final String PROPOSAL = "Proposal";
    public static final String NEGOTIATION = "Negotiation";
    public static final String CLOSED_WON = "Closed Won";
    public static final String CLOSED_LOST = "Closed Lost";

    public static final String PLANNING = "Planning";
    public static final String IN_PROGRESS = "In Progress";
    public static final String ON_HOLD = "On Hold";
    public static final String COMPLETED = "Completed";
    public static final String CANCELLED = "Cancelled";

    public static final Vocabulary SECTORS = Vocabulary.builder("sector")
            .term("Energy", "power", "utilities", "utility", "oil and gas", "oil & gas", "renewables", "renewable energy", "solar")
            .term("Technology", "tech", "software", "saas", "information technology", "digital")
            .term("Healthcare", "health care", "medical", "pharma", "pharmaceuticals", "biotech", "life sciences")
            .term("Finance", "financial services", "banking", "bank", "fintech", "insurance")
            .term("Manufacturing", "industrial", "industrials", "production", "factory")
            .term("Retail", "ecommerce", "e commerce", "consumer goods")
            .term("Education", "edtech", "higher education", "schools")
            .term("Government", "public sector", "govt", "municipal", "defense", "defence")
            .term("Infrastructure", "construction", "transport", "transportation", "logistics")
            .term("Telecom", "telecommunications", "telco")
            .lookupOnly("Technology", "it", "i t", "ict")
            .lookupOnly("Retail", "consumer")
            .lookupOnly("Finance", "financial")
            .lookupOnly("Healthcare", "health")
            .build();

    public static final Vocabulary DEAL_STAGES = Vocabulary.builder("stage")
            .term(LEAD, "leads", "prospect", "prospects", "prospecting")
            .term(QUALIFIED, "qualification", "sql", "discovery")
            .term(PROPOSAL, "proposal sent", "quoted", "quote sent", "rfp")
            .term(NEGOTIATION, "negotiating", "contracting", "in negotiation")
            .term(CLOSED_WON, "won", "deal won", "closed won deals")
            .term(CLOSED_LOST, "lost", "deal lost", "closed lost deals")
            .lookupOnly(LEAD, "new", "cold", "warm")
            .lookupOnly(PROPOSAL, "quote")
            .lookupOnly(CLOSED_WON, "signed", "win")
            .lookupOnly(CLOSED_LOST, "dead", "loss")
            .build();

    public static final Vocabulary WORK_ORDER_STATUSES = Vocabulary.builder("status")
            .term(PLANNING, "planned", "not started", "scheduled")
            .term(IN_PROGRESS, "ongoing", "underway", "in execution", "executing")
            .term(ON_HOLD, "paused", "blocked", "suspended")
            .term(COMPLETED, "finished", "complete")
            .term(CANCELLED, "canceled", "cancelled orders", "terminated")
            .lookupOnly(PLANNING, "todo", "to do", "backlog")
            .lookupOnly(IN_PROGRESS, "active", "started", "working on it", "wip")
            .lookupOnly(ON_HOLD, "hold", "stuck")
            .lookupOnly(COMPLETED, "done", "closed", "delivered")
            .build();

    private Vocabularies() {}
}
