// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.constructs.Construct;
import software.amazon.awscdk.RemovalPolicy;

import software.amazon.awscdk.services.ec2.IConnectable;
import software.amazon.awscdk.services.ec2.IVpc;
import software.amazon.awscdk.services.ec2.Port;
import software.amazon.awscdk.services.ec2.SecurityGroup;
import software.amazon.awscdk.services.ec2.SubnetSelection;
import software.amazon.awscdk.services.ec2.SubnetType;

import software.amazon.awscdk.services.ecs.AwsLogDriverProps;
import software.amazon.awscdk.services.ecs.Cluster;
import software.amazon.awscdk.services.ecs.ContainerDefinition;
import software.amazon.awscdk.services.ecs.ContainerDefinitionOptions;
import software.amazon.awscdk.services.ecs.ContainerImage;
import software.amazon.awscdk.services.ecs.FargateService;
import software.amazon.awscdk.services.ecs.FargateTaskDefinition;
import software.amazon.awscdk.services.ecs.LoadBalancerTargetOptions;
import software.amazon.awscdk.services.ecs.LogDriver;
import software.amazon.awscdk.services.ecs.PortMapping;
import software.amazon.awscdk.services.ecs.Protocol;

import software.amazon.awscdk.services.elasticloadbalancingv2.ApplicationTargetGroup;

import software.amazon.awscdk.services.logs.LogGroup;
import software.amazon.awscdk.services.logs.RetentionDays;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * WebGoat and WebWolf in a single Fargate task.
 */
public class WebGoatService extends Construct {
    static final String DEFAULT_IMAGE = "webgoat/webgoat:v2023.8";
    static final String CONTAINER_NAME = "WebgoatContainer";
    static final int WEBGOAT_PORT = 8080;
    static final int WEBWOLF_PORT = 9090;

    private final ContainerDefinition container;
    private final SecurityGroup securityGroup;
    private final FargateService service;

    public WebGoatService(final Construct scope, final String id, final WebGoatServiceProps props) {
        super(scope, id);

        IVpc vpc = Objects.requireNonNull(props.getVpc(), "vpc");
        String image = props.getImage();
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("WebGoat image must not be blank.");
        }

        Cluster cluster = Cluster.Builder.create(this, "wafTrialCluster")
            .clusterName("waf-trial-cluster")
            .vpc(vpc)
            .build();

        FargateTaskDefinition task = FargateTaskDefinition.Builder.create(this, "WebgoatTaskDefinition")
            .cpu(1024)
            .memoryLimitMiB(2048)
            .build();

        LogGroup logGroup = LogGroup.Builder.create(this, "webgoat-log-group")
            .retention(RetentionDays.ONE_DAY)
            .removalPolicy(RemovalPolicy.DESTROY)
            .build();

        // Both virtual hosts resolve to the same task
        Map<String, String> env = new LinkedHashMap<>();
        env.put("WEBGOAT_HOST", "www.webgoat.local");
        env.put("WEBWOLF_HOST", "www.webwolf.local");

        container = task.addContainer(CONTAINER_NAME, ContainerDefinitionOptions.builder()
            .image(ContainerImage.fromRegistry(image))
            .environment(env)
            .logging(LogDriver.awsLogs(AwsLogDriverProps.builder()
                .logGroup(logGroup)
                .streamPrefix("webgoat")
                .build()))
            .portMappings(List.of(
                PortMapping.builder().containerPort(WEBGOAT_PORT).protocol(Protocol.TCP).build(),
                PortMapping.builder().containerPort(WEBWOLF_PORT).protocol(Protocol.TCP).build()))
            .build());

        securityGroup = SecurityGroup.Builder.create(this, "FargateServiceSG")
            .vpc(vpc)
            .allowAllOutbound(true)
            .build();

        service = FargateService.Builder.create(this, "WebgoatService")
            .cluster(cluster)
            .taskDefinition(task)
            .desiredCount(1)
            .assignPublicIp(true)
            .vpcSubnets(SubnetSelection.builder()
                .subnetType(SubnetType.PUBLIC)
                .build())
            .securityGroups(List.of(securityGroup))
            .build();
    }

    /**
     * Registers the task in the target group on the given container port.
     * The port must be one the container maps.
     */
    public void attachTo(final ApplicationTargetGroup targetGroup, final int containerPort) {
        if (containerPort != WEBGOAT_PORT && containerPort != WEBWOLF_PORT) {
            throw new IllegalArgumentException("Container does not map port " + containerPort);
        }

        targetGroup.addTarget(service.loadBalancerTarget(LoadBalancerTargetOptions.builder()
            .containerName(container.getContainerName())
            .containerPort(containerPort)
            .protocol(Protocol.TCP)
            .build()));
    }

    public void allowFrom(final IConnectable source, final Port port, final String description) {
        securityGroup.getConnections().allowFrom(source, port, description);
    }

    public SecurityGroup getSecurityGroup() {
        return securityGroup;
    }
}
