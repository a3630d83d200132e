package eu.fbk.slopat.vocabulary;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The extraction label vocabulary with its default domain and ontology class tables.
 * <p>
 * {@link #LABELS} lists the labels requested from the span extraction model.
 * {@link #DOMAINS} maps each label to a coarse domain tag (labels missing from the table
 * belong to {@link #OTHER_DOMAIN}). {@link #CLASSES} maps labels to standard ontology classes,
 * expressed in short {@code prefix:local} form against the namespaces of
 * {@code Data.getNamespaceMap()}; labels missing from the table get no class.
 * </p>
 */
public final class ConceptLabels {

    /** Domain assigned to labels with no entry in a domain table. */
    public static final String OTHER_DOMAIN = "other";

    /** Label vocabulary, in the order it is offered to the extraction model. */
    public static final List<String> LABELS;

    /** Default label to domain table. */
    public static final Map<String, String> DOMAINS;

    /** Default label to ontology class table (short-form class identifiers). */
    public static final Map<String, String> CLASSES;

    static {
        final ImmutableMap.Builder<String, String> domains = ImmutableMap.builder();
        final ImmutableMap.Builder<String, String> classes = ImmutableMap.builder();

        // computer science
        register(domains, classes, "computer_science_concept", "cs", "cso:ComputerScience");
        register(domains, classes, "algorithm", "cs", "cso:Algorithm");
        register(domains, classes, "data_structure", "cs", "cso:DataStructure");
        register(domains, classes, "programming_language", "cs", "cso:ProgrammingLanguage");
        register(domains, classes, "software_system", "cs", "cso:SoftwareSystem");
        register(domains, classes, "distributed_system", "cs", "cso:DistributedSystem");
        register(domains, classes, "machine_learning_concept", "cs", "cso:MachineLearning");

        // mathematics
        register(domains, classes, "mathematics_concept", "math", "msc:Mathematics");
        register(domains, classes, "mathematical_theorem", "math", "msc:Theorem");
        register(domains, classes, "statistical_method", "math", "msc:Statistics");
        register(domains, classes, "mathematical_proof", "math", "msc:Proof");
        register(domains, classes, "equation", "math", "msc:Equation");

        // social sciences
        register(domains, classes, "social_science_concept", "social", "schema:SocialScience");
        register(domains, classes, "research_method", "social", "schema:ResearchMethod");
        register(domains, classes, "psychological_concept", "social", "schema:Psychology");
        register(domains, classes, "economic_concept", "social", "schema:Economics");
        register(domains, classes, "organizational_behavior", "social", "schema:Organization");

        // philosophy
        register(domains, classes, "philosophical_concept", "philosophy", "schema:Philosophy");
        register(domains, classes, "ethical_principle", "philosophy", "schema:Ethics");
        register(domains, classes, "logical_argument", "philosophy", "schema:Logic");
        register(domains, classes, "epistemological_concept", "philosophy",
                "schema:Epistemology");

        // general
        register(domains, classes, "person_mention", "people", "foaf:Person");
        register(domains, classes, "organization", "entities", "foaf:Organization");
        register(domains, classes, "academic_paper", "references", "schema:ScholarlyArticle");
        register(domains, classes, "research_finding", "findings", "schema:ResearchFindings");
        register(domains, classes, "methodology", "methods", "schema:ResearchMethod");
        register(domains, classes, "tool", "tools", "schema:SoftwareApplication");
        register(domains, classes, "framework", "tools", "schema:SoftwareApplication");

        DOMAINS = domains.build();
        CLASSES = classes.build();
        LABELS = ImmutableList.copyOf(DOMAINS.keySet());
    }

    private static void register(final ImmutableMap.Builder<String, String> domains,
            final ImmutableMap.Builder<String, String> classes, final String label,
            final String domain, final String type) {
        domains.put(label, domain);
        classes.put(label, type);
    }

    private ConceptLabels() {
    }

}
