package com.questrail.junction.api;

import java.util.Objects;
import java.util.Optional;

/**
 * One compiled row: the transition, the template it was dispatched to and its
 * outcome.
 *
 * <p>
 * The template is absent when no template exists for the transition's
 * classification pair. The sequence number follows the numbering of the
 * originating table, so the first row is normally 2.
 * </p>
 */
public final class OutputRow
{
    private final int sequence;
    private final String from;
    private final String to;
    private final TemplateCode template;
    private final RowOutcome outcome;

    public OutputRow(int sequence, String from, String to, TemplateCode template, RowOutcome outcome) {
        this.sequence = sequence;
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.template = template;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public int sequence() {
        return sequence;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    public Optional<TemplateCode> template() {
        return Optional.ofNullable(template);
    }

    public RowOutcome outcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    /**
     * @return the logic code, or {@code ERROR: <message>} for a failed row
     */
    public String logicCodeText() {
        return outcome.displayText();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutputRow that)) return false;
        return sequence == that.sequence
                && from.equals(that.from)
                && to.equals(that.to)
                && template == that.template
                && outcome.equals(that.outcome);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, from, to, template, outcome);
    }

    @Override
    public String toString() {
        return "OutputRow[" + sequence + " " + from + "->" + to
                + " " + (template == null ? "?" : template.name())
                + " " + logicCodeText() + "]";
    }
}
