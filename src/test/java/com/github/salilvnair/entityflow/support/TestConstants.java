package com.github.salilvnair.entityflow.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final String SESSION_ID = "session-1";

    public static final String MODEL_CUSTOMER = "customer";
    public static final String MODEL_PRODUCT = "product";

    public static final String FIELD_CUSTOMER = "customer";
    public static final String FIELD_PRODUCT = "product";
    public static final String FIELD_LINE_ITEMS = "line_items";

    public static final String WORKFLOW_CREATE_PRODUCT = "create_product";
    public static final String WORKFLOW_INVOICE = "invoice_workflow";

    public static final String NAME = "name";
    public static final String PRICE = "price";
    public static final String QUANTITY = "quantity";
    public static final String EMAIL = "email";
    public static final String INVOICE_NUMBER = "invoice_number";

    public static final String YES = "yes";
    public static final String NO = "no";
    public static final String BOOM = "boom";
}
