/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package trafficdb.query;

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable description of one aggregation: which entries to count (filter), how to group them
 * (group key extractor), what to compute per group (aggregate kind), and how to post-process
 * the merged groups (having threshold, order, limit).
 * <p>
 * Jobs are made with {@link #builder(AggregateKind)} or one of its shortcuts; building a job
 * validates it, so an executor is never handed a job it cannot run.
 */
public final class AggregationJob {
  private final AggregateKind kind;
  private final GroupKeyExtractor groupBy;
  @Nullable
  private final GroupKeyExtractor distinctOf;
  private final int topK;
  private final EntryFilter filter;
  @Nullable
  private final Long havingMoreThan;
  private final OrderBy orderBy;
  @Nullable
  private final Integer limit;

  private AggregationJob(Builder builder) {
    this.kind = builder.kind;
    this.groupBy = builder.groupBy;
    this.distinctOf = builder.distinctOf;
    this.topK = builder.topK;
    this.filter = builder.filter;
    this.havingMoreThan = builder.havingMoreThan;
    this.orderBy = builder.orderBy;
    this.limit = builder.limit;
  }

  public static Builder builder(AggregateKind kind) {
    return new Builder(kind);
  }

  public static Builder count() {
    return new Builder(AggregateKind.COUNT);
  }

  public static Builder countDistinct(GroupKeyExtractor of) {
    return new Builder(AggregateKind.COUNT_DISTINCT).distinctOf(of);
  }

  public static Builder topK(int k) {
    return new Builder(AggregateKind.TOP_K).k(k);
  }

  public AggregateKind getKind() {
    return kind;
  }

  public GroupKeyExtractor getGroupBy() {
    return groupBy;
  }

  /**
   * The field whose different values are counted, for COUNT_DISTINCT jobs; otherwise null.
   */
  @Nullable
  public GroupKeyExtractor getDistinctOf() {
    return distinctOf;
  }

  public int getTopK() {
    return topK;
  }

  public EntryFilter getFilter() {
    return filter;
  }

  /**
   * Groups whose value is not strictly greater than this are dropped after merging; null if
   * no group is dropped.
   */
  @Nullable
  public Long getHavingMoreThan() {
    return havingMoreThan;
  }

  public OrderBy getOrderBy() {
    return orderBy;
  }

  @Nullable
  public Integer getLimit() {
    return limit;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("kind", kind)
        .add("groupBy", groupBy)
        .add("distinctOf", distinctOf)
        .add("topK", kind == AggregateKind.TOP_K ? topK : null)
        .add("filter", filter)
        .add("havingMoreThan", havingMoreThan)
        .add("orderBy", orderBy)
        .add("limit", limit)
        .toString();
  }

  public static final class Builder {
    private final AggregateKind kind;
    private GroupKeyExtractor groupBy = GroupKeyExtractor.all();
    private GroupKeyExtractor distinctOf;
    private int topK;
    private EntryFilter filter = EntryFilter.all();
    private Long havingMoreThan;
    private OrderBy orderBy;
    private Integer limit;

    private Builder(AggregateKind kind) {
      this.kind = kind;
    }

    public Builder groupBy(GroupKeyExtractor groupBy) {
      this.groupBy = groupBy;
      return this;
    }

    public Builder groupBy(String extractorName) {
      return groupBy(GroupKeyExtractor.named(extractorName));
    }

    public Builder distinctOf(GroupKeyExtractor distinctOf) {
      this.distinctOf = distinctOf;
      return this;
    }

    public Builder k(int k) {
      this.topK = k;
      return this;
    }

    public Builder where(EntryFilter filter) {
      this.filter = filter;
      return this;
    }

    public Builder havingMoreThan(long threshold) {
      this.havingMoreThan = threshold;
      return this;
    }

    public Builder orderBy(OrderBy orderBy) {
      this.orderBy = orderBy;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    /**
     * @throws InvalidJobSpecException if the settings do not describe a runnable job.
     */
    public AggregationJob build() {
      if (kind == null) {
        throw new InvalidJobSpecException("Aggregate kind must be given");
      }
      if (groupBy == null) {
        throw new InvalidJobSpecException("Group key extractor must not be null");
      }
      if (filter == null) {
        throw new InvalidJobSpecException("Filter must not be null");
      }

      switch (kind) {
        case COUNT_DISTINCT:
          if (distinctOf == null) {
            throw new InvalidJobSpecException("COUNT_DISTINCT requires the field to count");
          }
          break;
        case TOP_K:
          if (topK <= 0) {
            throw new InvalidJobSpecException("TOP_K requires a positive k, not " + topK);
          }
          if (orderBy != null && orderBy != OrderBy.COUNT_DESC) {
            throw new InvalidJobSpecException("TOP_K results are always ordered by COUNT_DESC, not " + orderBy);
          }
          orderBy = OrderBy.COUNT_DESC;
          break;
        default:
          break;
      }

      if (kind != AggregateKind.COUNT_DISTINCT && distinctOf != null) {
        throw new InvalidJobSpecException("Only COUNT_DISTINCT takes a field to count");
      }
      if (limit != null && limit <= 0) {
        throw new InvalidJobSpecException("Limit must be positive, not " + limit);
      }
      if (havingMoreThan != null && havingMoreThan < 0) {
        throw new InvalidJobSpecException("Having threshold must not be negative, not " + havingMoreThan);
      }
      if (orderBy == null) {
        orderBy = OrderBy.NONE;
      }

      return new AggregationJob(this);
    }
  }
}
