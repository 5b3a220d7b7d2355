package io.intellixity.mapflow.engine.compile;

import io.intellixity.mapflow.engine.phase.PhaseBehaviorClassifier;
import io.intellixity.mapflow.phase.ExecutionTarget;
import io.intellixity.mapflow.phase.ExecutorKind;
import io.intellixity.mapflow.phase.PhaseDefinition;
import io.intellixity.mapflow.query.FunctionReference;
import io.intellixity.mapflow.query.PhaseKind;
import io.intellixity.mapflow.query.QueryTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns query terms into phase definitions.\n
 *
 * Terms are checked in query order and the first term that fails ends validation: the result then
 * carries that term as submitted and no phase list is produced. Stored scripting sources are fetched
 * while checking; a failed fetch rejects the term like any malformed one.\n
 */
public final class QuerySyntaxValidator {
  private static final Logger log = LoggerFactory.getLogger(QuerySyntaxValidator.class);

  private final FunctionReferenceResolver resolver;
  private final PhaseBehaviorClassifier classifier;

  public QuerySyntaxValidator(FunctionReferenceResolver resolver) {
    this(resolver, new PhaseBehaviorClassifier());
  }

  public QuerySyntaxValidator(FunctionReferenceResolver resolver, PhaseBehaviorClassifier classifier) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.classifier = (classifier == null) ? new PhaseBehaviorClassifier() : classifier;
  }

  public ValidationResult validate(List<QueryTerm> terms) {
    Objects.requireNonNull(terms, "terms");

    List<PhaseDefinition> phases = new ArrayList<>(terms.size());
    for (int i = 0; i < terms.size(); i++) {
      QueryTerm term = terms.get(i);
      PhaseDefinition def = (term == null) ? null : toPhase(term);
      if (def == null) {
        log.debug("Rejected query term {} of {}: {}", i + 1, terms.size(), term);
        return ValidationResult.invalid(term);
      }
      if (log.isDebugEnabled()) {
        log.debug("Accepted query term {} of {}: executor={} behaviors={} runtime={}",
            i + 1, terms.size(), def.executor(), def.behaviors(), def.target().runtime());
      }
      phases.add(def);
    }
    return ValidationResult.valid(phases);
  }

  /** Returns null when the term is not acceptable. */
  private PhaseDefinition toPhase(QueryTerm term) {
    if (term.kind() == PhaseKind.LINK) {
      return define(term, ExecutionTarget.nativeLocal(term));
    }

    QueryTerm resolved = checkFunction(term);
    if (resolved == null) return null;
    FunctionReference fn = resolved.function();
    return define(term, fn.scripting() ? ExecutionTarget.scripting(resolved) : ExecutionTarget.nativeLocal(resolved));
  }

  /** The term to execute (stored sources replaced by their text), or null when the reference is malformed. */
  private QueryTerm checkFunction(QueryTerm term) {
    FunctionReference fn = term.function();
    if (fn instanceof FunctionReference.ModuleFunction mf) {
      return (isBlank(mf.module()) || isBlank(mf.function())) ? null : term;
    }
    if (fn instanceof FunctionReference.InlineFunction f) {
      return f.handle() == null ? null : term;
    }
    if (fn instanceof FunctionReference.SourceText st) {
      return st.text() == null ? null : term;
    }
    if (fn instanceof FunctionReference.RemoteSourceText rs) {
      return rs.text() == null ? null : term;
    }
    if (fn instanceof FunctionReference.RemoteFunctionName rn) {
      return rn.name() == null ? null : term;
    }
    if (fn instanceof FunctionReference.RemoteStoredSource rss) {
      if (isBlank(rss.bucket()) || isBlank(rss.key())) return null;
      try {
        return term.withFunction(resolver.resolve(rss));
      } catch (SourceFetchException e) {
        return null;
      }
    }

    // Unrecognized shape or missing function
    return null;
  }

  private PhaseDefinition define(QueryTerm term, ExecutionTarget target) {
    return new PhaseDefinition(
        ExecutorKind.forPhase(term.kind()),
        classifier.classify(term.kind(), term.accumulate()),
        target
    );
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
