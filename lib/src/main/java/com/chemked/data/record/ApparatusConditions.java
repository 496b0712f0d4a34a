package com.chemked.data.record;

/** Data point fields that only make sense for one kind of apparatus. */
public sealed interface ApparatusConditions permits ShockTubeConditions, RcmConditions {

    ApparatusKind getApparatusKind();
}
