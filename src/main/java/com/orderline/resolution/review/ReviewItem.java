package com.orderline.resolution.review;

import com.orderline.resolution.core.model.DecisionTier;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An order line that could not be confirmed automatically. Holds the top candidate,
 * if any, so a reviewer can accept it or pick another product.
 */
public class ReviewItem {

    private final String id;
    private final String parsedLineId;
    private final String rawText;
    private final String candidateProductId;
    private final String candidateName;
    private final double score;
    private final DecisionTier tier;
    private final String customerSegment;
    private final Instant submittedAt;
    private ReviewStatus status;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;
    private String chosenProductId;
    private String orderLineId;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.parsedLineId = Objects.requireNonNull(builder.parsedLineId, "parsedLineId is required");
        this.rawText = builder.rawText;
        this.candidateProductId = builder.candidateProductId;
        this.candidateName = builder.candidateName;
        this.score = builder.score;
        this.tier = Objects.requireNonNull(builder.tier, "tier is required");
        this.customerSegment = builder.customerSegment;
        this.status = ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getParsedLineId() {
        return parsedLineId;
    }

    public String getRawText() {
        return rawText;
    }

    /**
     * Top-ranked product, or null when the line had no candidates.
     */
    public String getCandidateProductId() {
        return candidateProductId;
    }

    public String getCandidateName() {
        return candidateName;
    }

    public double getScore() {
        return score;
    }

    public DecisionTier getTier() {
        return tier;
    }

    public String getCustomerSegment() {
        return customerSegment;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public synchronized String getChosenProductId() {
        return chosenProductId;
    }

    /**
     * The order line created on approval, or null.
     */
    public synchronized String getOrderLineId() {
        return orderLineId;
    }

    public synchronized boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void markApproved(String reviewerId, String chosenProductId, String orderLineId, String notes) {
        this.status = ReviewStatus.APPROVED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.chosenProductId = chosenProductId;
        this.orderLineId = orderLineId;
        this.notes = notes;
    }

    synchronized void markRejected(String reviewerId, String notes) {
        this.status = ReviewStatus.REJECTED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", parsedLineId='" + parsedLineId + '\'' +
                ", candidateProductId='" + candidateProductId + '\'' +
                ", score=" + score +
                ", tier=" + tier +
                ", status=" + getStatus() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String parsedLineId;
        private String rawText;
        private String candidateProductId;
        private String candidateName;
        private double score;
        private DecisionTier tier;
        private String customerSegment;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder parsedLineId(String parsedLineId) {
            this.parsedLineId = parsedLineId;
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder candidateProductId(String candidateProductId) {
            this.candidateProductId = candidateProductId;
            return this;
        }

        public Builder candidateName(String candidateName) {
            this.candidateName = candidateName;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder tier(DecisionTier tier) {
            this.tier = tier;
            return this;
        }

        public Builder customerSegment(String customerSegment) {
            this.customerSegment = customerSegment;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
