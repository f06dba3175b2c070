// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.constructs.Construct;

import software.amazon.awscdk.services.elasticloadbalancingv2.IApplicationLoadBalancer;
import software.amazon.awscdk.services.wafv2.CfnWebACL;
import software.amazon.awscdk.services.wafv2.CfnWebACLAssociation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Regional web ACL built from two AWS managed rule groups.
 */
public class TrialWebAcl extends Construct {
    static final String COMMON_RULE_SET = "AWSManagedRulesCommonRuleSet";
    static final String SQLI_RULE_SET = "AWSManagedRulesSQLiRuleSet";

    /**
     * Rules of the common rule set that are turned off. A payload bigger than
     * the inspection limit is not blocked, which is the gap the trial lets
     * people find. Do not remove entries from this list.
     */
    static final List<String> EXCLUDED_COMMON_RULES = List.of(
        "SizeRestrictions_QUERYSTRING",
        "SizeRestrictions_Cookie_HEADER",
        "SizeRestrictions_BODY",
        "SizeRestrictions_URIPATH");

    private final CfnWebACL webAcl;
    private final List<IApplicationLoadBalancer> associated = new ArrayList<>();

    public TrialWebAcl(final Construct scope, final String id) {
        super(scope, id);

        List<CfnWebACL.ExcludedRuleProperty> excludedRules = new ArrayList<>();
        for (String rule : EXCLUDED_COMMON_RULES) {
            excludedRules.add(CfnWebACL.ExcludedRuleProperty.builder().name(rule).build());
        }

        webAcl = CfnWebACL.Builder.create(this, "cfnWebACL")
            .defaultAction(CfnWebACL.DefaultActionProperty.builder()
                .allow(CfnWebACL.AllowActionProperty.builder().build())
                .build())
            .scope("REGIONAL")
            .visibilityConfig(CfnWebACL.VisibilityConfigProperty.builder()
                .cloudWatchMetricsEnabled(false)
                .sampledRequestsEnabled(false)
                .metricName("WebGoatMetrics")
                .build())
            .name("WebGoatWebAclName")
            .rules(List.of(
                managedRule(COMMON_RULE_SET, 1, excludedRules),
                managedRule(SQLI_RULE_SET, 2, null)))
            .build();
    }

    private static CfnWebACL.RuleProperty managedRule(String name, int priority,
        List<CfnWebACL.ExcludedRuleProperty> excludedRules) {
        return CfnWebACL.RuleProperty.builder()
            .name(name)
            .priority(priority)
            .statement(CfnWebACL.StatementProperty.builder()
                .managedRuleGroupStatement(CfnWebACL.ManagedRuleGroupStatementProperty.builder()
                    .vendorName("AWS")
                    .name(name)
                    .excludedRules(excludedRules)
                    .build())
                .build())
            .visibilityConfig(CfnWebACL.VisibilityConfigProperty.builder()
                .cloudWatchMetricsEnabled(true)
                .sampledRequestsEnabled(true)
                .metricName(name)
                .build())
            .overrideAction(CfnWebACL.OverrideActionProperty.builder()
                .none(Map.of())
                .build())
            .build();
    }

    /**
     * Puts the load balancer behind this web ACL. The association is ordered
     * after the web ACL itself.
     */
    public CfnWebACLAssociation associate(final String id, final IApplicationLoadBalancer loadBalancer) {
        if (associated.contains(loadBalancer)) {
            throw new IllegalStateException("Load balancer " + loadBalancer.getNode().getPath()
                + " is already associated with " + getNode().getPath());
        }

        CfnWebACLAssociation association = CfnWebACLAssociation.Builder.create(this, id)
            .resourceArn(loadBalancer.getLoadBalancerArn())
            .webAclArn(webAcl.getAttrArn())
            .build();
        association.addDependency(webAcl);
        associated.add(loadBalancer);
        return association;
    }

    public CfnWebACL getWebAcl() {
        return webAcl;
    }
}
