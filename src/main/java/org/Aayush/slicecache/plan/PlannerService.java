package org.Aayush.slicecache.plan;

/**
 * Public planning contract.
 *
 * <p>Implementations validate requests deterministically and throw
 * {@link SliceCacheException} for contract failures only.</p>
 */
public interface PlannerService {

    /**
     * Decides whether cached slices answer the request, or what must be fetched.
     *
     * @param request planning request.
     * @return satisfied value with disclosures, or fetch plan items.
     */
    PlanResult plan(PlanRequest request);
}
