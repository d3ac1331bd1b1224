package com.tfve.sync.core.model;

/**
 * A workspace variable as the API reports it.
 *
 * @param id variable id ({@code var-...})
 * @param name variable key
 * @param hcl whether the value is parsed as an HCL expression remotely
 * @param rawValue stored value, {@code null} for sensitive variables
 * @param description stored description, may be {@code null}
 * @param category {@code terraform} or {@code env}
 */
public record RemoteVariable(String id, String name, boolean hcl, String rawValue, String description, String category) {

    public static final String TERRAFORM_CATEGORY = "terraform";

    public boolean isTerraformVariable() {
        return category == null || TERRAFORM_CATEGORY.equals(category);
    }
}
