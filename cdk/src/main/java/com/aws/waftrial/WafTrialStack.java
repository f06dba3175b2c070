// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.constructs.Construct;
import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.Stack;

import software.amazon.awscdk.services.ec2.IpAddresses;
import software.amazon.awscdk.services.ec2.Peer;
import software.amazon.awscdk.services.ec2.Port;
import software.amazon.awscdk.services.ec2.SubnetConfiguration;
import software.amazon.awscdk.services.ec2.SubnetType;
import software.amazon.awscdk.services.ec2.Vpc;

import software.amazon.awscdk.services.elasticloadbalancingv2.AddApplicationActionProps;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationListener;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationLoadBalancer;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationProtocol;
import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationTargetGroup;
import software.amazon.awscdk.services.elasticloadbalancingv2.BaseApplicationListenerProps;
import software.amazon.awscdk.services.elasticloadbalancingv2.HealthCheck;
import software.amazon.awscdk.services.elasticloadbalancingv2.ListenerAction;
import software.amazon.awscdk.services.elasticloadbalancingv2.TargetType;

import java.util.List;

/**
 * WebGoat behind two load balancers, one covered by AWS WAF and one raw, both
 * reachable only from the bastion host.
 */
public class WafTrialStack extends Stack {
    static final int HTTP_PORT = 80;
    static final String HEALTHY_HTTP_CODES = "200-499";

    private final Vpc vpc;
    private final BastionHost bastion;
    private final WebGoatService webGoat;
    private final TrialWebAcl webAcl;
    private final ApplicationLoadBalancer wafLoadBalancer;
    private final ApplicationLoadBalancer rawLoadBalancer;

    public WafTrialStack(final Construct parent, final String id, final WafTrialStackProps props) {
        super(parent, id, props);

        vpc = Vpc.Builder.create(this, "wafTrialVPC")
            .natGateways(0)
            .ipAddresses(IpAddresses.cidr("10.0.0.0/16"))
            .vpcName("wafTrialVPC")
            .maxAzs(2)
            .subnetConfiguration(List.of(SubnetConfiguration.builder()
                .cidrMask(24)
                .name("waf-trial-public")
                .subnetType(SubnetType.PUBLIC)
                .mapPublicIpOnLaunch(true)
                .build()))
            .build();

        bastion = new BastionHost(this, "Bastion", BastionHostProps.builder()
            .vpc(vpc)
            .allowedIp(props.getAllowedIp())
            .allowedPrefixId(props.getAllowedPrefixId())
            .build());

        webGoat = new WebGoatService(this, "WebGoat", WebGoatServiceProps.builder()
            .vpc(vpc)
            .image(props.getWebGoatImage())
            .build());

        webAcl = new TrialWebAcl(this, "WebAcl");

        wafLoadBalancer = ApplicationLoadBalancer.Builder.create(this, "WebgoatLB")
            .vpc(vpc)
            .internetFacing(true)
            .build();

        rawLoadBalancer = ApplicationLoadBalancer.Builder.create(this, "WebgoatRAWLB")
            .vpc(vpc)
            .internetFacing(true)
            .build();

        webAcl.associate("webAclAssociation", wafLoadBalancer);

        ApplicationTargetGroup webGoatTargetGroup = webGoatTargetGroup("TargetGroup1",
            WebGoatService.WEBGOAT_PORT, "/WebGoat");
        ApplicationTargetGroup webWolfTargetGroup = webGoatTargetGroup("TargetGroup2",
            WebGoatService.WEBWOLF_PORT, "/WebWolf");
        ApplicationTargetGroup rawTargetGroup = webGoatTargetGroup("TargetGroup3",
            WebGoatService.WEBGOAT_PORT, "/WebGoat");

        forward(wafLoadBalancer, "WebgoatLBListener", HTTP_PORT, webGoatTargetGroup);
        forward(wafLoadBalancer, "WebwolfLBListener", WebGoatService.WEBWOLF_PORT, webWolfTargetGroup);
        forward(rawLoadBalancer, "RawLBListener", HTTP_PORT, rawTargetGroup);

        webGoat.allowFrom(wafLoadBalancer, Port.tcp(WebGoatService.WEBGOAT_PORT), "webgoat from waf load balancer");
        webGoat.allowFrom(wafLoadBalancer, Port.tcp(WebGoatService.WEBWOLF_PORT), "webwolf from waf load balancer");
        webGoat.allowFrom(rawLoadBalancer, Port.tcp(WebGoatService.WEBGOAT_PORT), "webgoat from raw load balancer");
        webGoat.allowFrom(bastion.getSecurityGroup(), Port.allTraffic(), "operator access from bastion");

        webGoat.attachTo(webGoatTargetGroup, WebGoatService.WEBGOAT_PORT);
        webGoat.attachTo(webWolfTargetGroup, WebGoatService.WEBWOLF_PORT);
        webGoat.attachTo(rawTargetGroup, WebGoatService.WEBGOAT_PORT);

        // The load balancers only answer the bastion's public address
        allowFromBastion(wafLoadBalancer, HTTP_PORT);
        allowFromBastion(wafLoadBalancer, WebGoatService.WEBWOLF_PORT);
        allowFromBastion(rawLoadBalancer, HTTP_PORT);

        CfnOutput.Builder.create(this, "LoadBalancerWafDomainName")
            .value(wafLoadBalancer.getLoadBalancerDnsName())
            .build();
        CfnOutput.Builder.create(this, "LoadBalancerRawDomainName")
            .value(rawLoadBalancer.getLoadBalancerDnsName())
            .build();
        CfnOutput.Builder.create(this, "BastionServerEIP")
            .value(bastion.getEip().getRef())
            .build();
    }

    private ApplicationTargetGroup webGoatTargetGroup(String id, int port, String healthCheckPath) {
        return ApplicationTargetGroup.Builder.create(this, id)
            .vpc(vpc)
            .port(port)
            .protocol(ApplicationProtocol.HTTP)
            .targetType(TargetType.IP)
            .healthCheck(HealthCheck.builder()
                .path(healthCheckPath)
                .healthyHttpCodes(HEALTHY_HTTP_CODES)
                .build())
            .build();
    }

    private static ApplicationListener forward(ApplicationLoadBalancer loadBalancer, String id, int port,
        ApplicationTargetGroup targetGroup) {
        // open(false): ingress is granted explicitly, never to 0.0.0.0/0
        ApplicationListener listener = loadBalancer.addListener(id, BaseApplicationListenerProps.builder()
            .port(port)
            .protocol(ApplicationProtocol.HTTP)
            .open(false)
            .build());

        listener.addAction("DefaultAction", AddApplicationActionProps.builder()
            .action(ListenerAction.forward(List.of(targetGroup)))
            .build());
        return listener;
    }

    private void allowFromBastion(ApplicationLoadBalancer loadBalancer, int port) {
        loadBalancer.getConnections().allowFrom(Peer.prefixList(bastion.getPrefixListId()), Port.tcp(port),
            "allow http access from bastion server prefix list");
    }

    public BastionHost getBastion() {
        return bastion;
    }

    public WebGoatService getWebGoat() {
        return webGoat;
    }

    public TrialWebAcl getWebAcl() {
        return webAcl;
    }

    public ApplicationLoadBalancer getWafLoadBalancer() {
        return wafLoadBalancer;
    }

    public ApplicationLoadBalancer getRawLoadBalancer() {
        return rawLoadBalancer;
    }
}
