package com.formflow.formflow_engine.model.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Repeats the actions of the action group {@link #actionGroupId} over a list, a count range,
 * a condition or a paginated source. Timeouts and delays are in milliseconds.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class LoopFormAction extends FormAction {

    private LoopType loopType = LoopType.LIST;
    private String actionGroupId;

    private String listDataSource;
    private String conditionExpression;
    // COUNT starts at 0 and PAGINATION at page 1 when unset
    private Integer countStart;
    private Integer countEnd = 0;
    private Integer countStep = 1;
    private PaginationConfig paginationConfig;

    private String itemVariableName = "item";
    private String indexVariableName = "index";
    private String totalVariableName = "total";

    private int maxIterations = 1000;
    private Long timeout;
    private Long singleIterationTimeout;
    private ErrorHandlingStrategy errorHandlingStrategy = ErrorHandlingStrategy.STOP;
    private Integer retryCount;
    private Long retryDelay;

    private Boolean showProgress;

    public LoopFormAction() {
        setType(ActionType.LOOP);
    }

    public LoopFormAction(String id, LoopType loopType, String actionGroupId) {
        this();
        setId(id);
        this.loopType = loopType;
        this.actionGroupId = actionGroupId;
    }
}
